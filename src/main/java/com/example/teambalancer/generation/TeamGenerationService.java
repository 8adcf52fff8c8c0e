package com.example.teambalancer.generation;

import com.example.teambalancer.config.GenerationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Random;
import java.util.function.BooleanSupplier;

@Service
public class TeamGenerationService {
    private static final Logger logger = LoggerFactory.getLogger(TeamGenerationService.class);

    private final TeamGenerator generator;
    private final GenerationSettings settings;

    public TeamGenerationService(TeamGenerator generator, GenerationSettings settings) {
        this.generator = generator;
        this.settings = settings;
    }

    /**
     * @param maxAttempts overrides the configured attempt budget when not null
     * @param seed        makes the call reproducible when not null
     */
    public GenerationResult generate(GenerationRequest request, Integer maxAttempts, Long seed) {
        int attempts = maxAttempts != null && maxAttempts > 0 ? maxAttempts : settings.getMaxAttempts();
        GenerationRequest effective = new GenerationRequest(request.members(), request.exclusionRules(),
                request.cohesionRules(), request.teamCount(), attempts);
        Random random = seed != null ? new Random(seed) : new Random();

        long started = System.currentTimeMillis();
        GenerationResult result = generator.generate(effective, random, deadline(started));
        long elapsed = System.currentTimeMillis() - started;

        if (result instanceof GenerationResult.Failure failure) {
            logger.warn("チーム生成に失敗しました: kind={} message={} attempts={} ({} ms)",
                    failure.errorKind(), failure.message(), failure.attemptsUsed(), elapsed);
        } else {
            logger.info("チーム生成が完了しました: members={} teams={} attempt={} ({} ms)",
                    effective.members().size(), effective.teamCount(), result.attemptsUsed(), elapsed);
        }
        return result;
    }

    private BooleanSupplier deadline(long started) {
        long budget = settings.getTimeBudgetMillis();
        if (budget <= 0) {
            return () -> false;
        }
        return () -> System.currentTimeMillis() - started >= budget;
    }
}
