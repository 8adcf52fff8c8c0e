package com.example.teambalancer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class GenerationSettings {
    private final int maxAttempts;
    private final int localSearchIterations;
    private final int minTeams;
    private final int maxTeams;
    private final long timeBudgetMillis;
    private final Locale nameLocale;

    public GenerationSettings(
            @Value("${teams.generation.max-attempts:2000}") int maxAttempts,
            @Value("${teams.generation.local-search.max-iterations:120}") int localSearchIterations,
            @Value("${teams.generation.team-count.min:2}") int minTeams,
            @Value("${teams.generation.team-count.max:10}") int maxTeams,
            @Value("${teams.generation.time-budget-ms:0}") long timeBudgetMillis,
            @Value("${teams.generation.name-locale:sv-SE}") String nameLocale) {
        if (minTeams < 1 || maxTeams < minTeams) {
            throw new IllegalArgumentException("invalid team count bounds: " + minTeams + ".." + maxTeams);
        }
        this.maxAttempts = Math.max(1, maxAttempts);
        this.localSearchIterations = Math.max(0, localSearchIterations);
        this.minTeams = minTeams;
        this.maxTeams = maxTeams;
        this.timeBudgetMillis = Math.max(0, timeBudgetMillis);
        this.nameLocale = Locale.forLanguageTag(nameLocale);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public int getLocalSearchIterations() { return localSearchIterations; }
    public int getMinTeams() { return minTeams; }
    public int getMaxTeams() { return maxTeams; }
    // 0 means unlimited
    public long getTimeBudgetMillis() { return timeBudgetMillis; }
    public Locale getNameLocale() { return nameLocale; }
}
