package com.example.teambalancer.generation;

import com.example.teambalancer.allocation.Allocation;
import com.example.teambalancer.allocation.LocalSearchRefiner;
import com.example.teambalancer.allocation.QualityEvaluator;
import com.example.teambalancer.allocation.QualityVector;
import com.example.teambalancer.allocation.RandomizedGreedyAssigner;
import com.example.teambalancer.allocation.TargetDistribution;
import com.example.teambalancer.allocation.TargetDistributionCalculator;
import com.example.teambalancer.exception.TeamGenerationException;
import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.grouping.AtomicGroupFormer;
import com.example.teambalancer.grouping.GroupConflictGraph;
import com.example.teambalancer.grouping.GroupConflictProjector;
import com.example.teambalancer.roster.Member;
import com.example.teambalancer.roster.NameNormalizer;
import com.example.teambalancer.roster.NormalizedRoster;
import com.example.teambalancer.roster.RosterNormalizer;
import com.example.teambalancer.rules.ConstraintGraphBuilder;
import com.example.teambalancer.rules.ConstraintGraphs;
import com.example.teambalancer.rules.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.BooleanSupplier;

/**
 * Runs the whole pipeline for one roster snapshot: validation, constraint
 * graphs, atomic groups, targets, then up to {@code maxAttempts} randomized
 * constructions each followed by local search. Keeps the best allocation by
 * {@link QualityVector} and stops early on a perfect one.
 * <p>
 * Holds no state between calls. All randomness comes from the {@link Random}
 * passed to {@link #generate}, so a seeded generator gives a reproducible result.
 */
public class TeamGenerator {

    private static final Logger logger = LoggerFactory.getLogger(TeamGenerator.class);

    private final RosterNormalizer rosterNormalizer;
    private final ConstraintGraphBuilder graphBuilder;
    private final AtomicGroupFormer groupFormer = new AtomicGroupFormer();
    private final GroupConflictProjector conflictProjector = new GroupConflictProjector();
    private final TargetDistributionCalculator distributionCalculator = new TargetDistributionCalculator();
    private final RandomizedGreedyAssigner assigner = new RandomizedGreedyAssigner();
    private final QualityEvaluator evaluator = new QualityEvaluator();
    private final LocalSearchRefiner refiner;
    private final int minTeams;
    private final int maxTeams;

    public TeamGenerator(NameNormalizer names, int localSearchIterations, int minTeams, int maxTeams) {
        this.rosterNormalizer = new RosterNormalizer(names);
        this.graphBuilder = new ConstraintGraphBuilder(new RuleValidator(names));
        this.refiner = new LocalSearchRefiner(evaluator, localSearchIterations);
        this.minTeams = minTeams;
        this.maxTeams = maxTeams;
    }

    public static TeamGenerator withDefaults() {
        return new TeamGenerator(NameNormalizer.defaultNormalizer(), LocalSearchRefiner.DEFAULT_MAX_ITERATIONS, 2, 10);
    }

    public GenerationResult generate(GenerationRequest request, Random random) {
        return generate(request, random, () -> false);
    }

    public GenerationResult generate(GenerationRequest request, Random random, BooleanSupplier cancelled) {
        Prepared prepared;
        try {
            prepared = prepare(request);
        } catch (TeamGenerationException e) {
            logger.debug("Generation rejected before any attempt: {} {}", e.getErrorKind(), e.getParameters());
            return new GenerationResult.Failure(e.getErrorKind(), e.getMessage(), e.getSuggestion(), 0);
        }
        return search(prepared, Math.max(1, request.maxAttempts()), random, cancelled);
    }

    private Prepared prepare(GenerationRequest request) {
        NormalizedRoster roster = rosterNormalizer.normalize(request.members());
        List<Member> present = roster.presentMembers();
        int teamCount = request.teamCount();
        if (present.isEmpty()) {
            throw new TeamGenerationException(ErrorKind.EMPTY_ROSTER);
        }
        if (teamCount < minTeams || teamCount > maxTeams) {
            throw new TeamGenerationException(ErrorKind.TEAM_COUNT_OUT_OF_RANGE,
                    ErrorKind.TEAM_COUNT_OUT_OF_RANGE.getMessage() + " (" + minTeams + "〜" + maxTeams + ")",
                    List.of(String.valueOf(teamCount)));
        }
        if (teamCount > present.size()) {
            throw new TeamGenerationException(ErrorKind.TEAM_COUNT_EXCEEDS_PRESENT,
                    List.of(teamCount + " > " + present.size()));
        }

        ConstraintGraphs graphs = graphBuilder.build(roster, request.exclusionRules(), request.cohesionRules());
        List<AtomicGroup> groups = groupFormer.form(present, graphs.cohesion());
        TargetDistribution targets = distributionCalculator.calculate(present, teamCount);
        GroupConflictGraph conflicts = conflictProjector.project(groups, graphs.exclusion(), targets.maxTargetSize());
        if (groups.size() < teamCount) {
            throw new TeamGenerationException(ErrorKind.TOO_FEW_GROUPS,
                    List.of(groups.size() + " < " + teamCount));
        }
        return new Prepared(groups, conflicts, targets);
    }

    private GenerationResult search(Prepared prepared, int attemptLimit, Random random, BooleanSupplier cancelled) {
        Allocation best = null;
        QualityVector bestQuality = null;
        int bestAttempt = 0;
        int attemptsRun = 0;

        for (int attempt = 1; attempt <= attemptLimit; attempt++) {
            if (cancelled.getAsBoolean()) {
                logger.info("Generation cancelled after {} attempts", attemptsRun);
                break;
            }
            attemptsRun = attempt;
            Optional<Allocation> constructed = assigner.assign(prepared.groups(), prepared.conflicts(),
                    prepared.targets(), random);
            if (constructed.isEmpty()) {
                logger.trace("Attempt {} found no eligible team for some group", attempt);
                continue;
            }
            LocalSearchRefiner.Refinement refined = refiner.refine(constructed.get(), prepared.conflicts(),
                    prepared.targets());
            if (bestQuality == null || refined.quality().isBetterThan(bestQuality)) {
                best = refined.allocation();
                bestQuality = refined.quality();
                bestAttempt = attempt;
                logger.debug("Attempt {} improved best to {} after {} local search steps",
                        attempt, bestQuality, refined.iterations());
            }
            if (bestQuality.isPerfect()) {
                break;
            }
        }

        if (best == null) {
            ErrorKind kind = attemptsRun < attemptLimit ? ErrorKind.CANCELLED : ErrorKind.NO_FEASIBLE_ALLOCATION;
            logger.info("Generation failed: {} after {} attempts", kind, attemptsRun);
            return GenerationResult.Failure.of(kind, attemptsRun);
        }
        logger.info("Generated {} teams at attempt {} of {} run, quality {}",
                prepared.targets().teamCount(), bestAttempt, attemptsRun, bestQuality);
        return new GenerationResult.Success(best.toMemberLists(), bestAttempt, attemptsRun, bestQuality);
    }

    private record Prepared(List<AtomicGroup> groups, GroupConflictGraph conflicts, TargetDistribution targets) { }
}
