package com.example.teambalancer.config;

import com.example.teambalancer.generation.TeamGenerator;
import com.example.teambalancer.roster.NameNormalizer;
import com.example.teambalancer.roster.RosterNormalizer;
import com.example.teambalancer.roster.RosterTextParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GenerationConfig {

    @Bean
    public NameNormalizer nameNormalizer(GenerationSettings settings) {
        return new NameNormalizer(settings.getNameLocale());
    }

    /**
     * The generator is stateless between calls, so one instance serves all requests.
     */
    @Bean
    public TeamGenerator teamGenerator(NameNormalizer nameNormalizer, GenerationSettings settings) {
        return new TeamGenerator(nameNormalizer, settings.getLocalSearchIterations(),
                settings.getMinTeams(), settings.getMaxTeams());
    }

    @Bean
    public RosterNormalizer rosterNormalizer(NameNormalizer nameNormalizer) {
        return new RosterNormalizer(nameNormalizer);
    }

    @Bean
    public RosterTextParser rosterTextParser(NameNormalizer nameNormalizer) {
        return new RosterTextParser(nameNormalizer);
    }
}
