package com.example.teambalancer.allocation;

import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.grouping.GroupConflictGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-improvement hill climbing over two neighbourhoods: moving one group to
 * another team, and swapping two groups between teams. Three-way rotations are
 * not explored, so some local optima are final.
 * <p>
 * Team sizes are bounded only through {@link QualityVector#sizeDeviation()},
 * which ranks first, so no accepted move pushes a team further outside the
 * even split.
 */
public class LocalSearchRefiner {

    public static final int DEFAULT_MAX_ITERATIONS = 120;

    private final QualityEvaluator evaluator;
    private final int maxIterations;

    public LocalSearchRefiner(QualityEvaluator evaluator, int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must not be negative: " + maxIterations);
        }
        this.evaluator = evaluator;
        this.maxIterations = maxIterations;
    }

    /**
     * Works on a copy of {@code start} and returns the improved allocation.
     * Deterministic for a given starting allocation.
     */
    public Refinement refine(Allocation start, GroupConflictGraph conflicts, TargetDistribution targets) {
        Allocation current = start.copy();
        QualityVector quality = evaluator.evaluate(current, targets);
        int iterations = 0;
        while (iterations < maxIterations && !quality.isPerfect()) {
            Move best = findBestMove(current, quality, conflicts, targets);
            if (best == null) {
                break;
            }
            best.applyTo(current);
            quality = best.result();
            iterations++;
        }
        return new Refinement(current, quality, iterations);
    }

    private Move findBestMove(Allocation allocation, QualityVector baseline,
                              GroupConflictGraph conflicts, TargetDistribution targets) {
        List<TeamTally> tallies = allocation.tallies();
        int teamCount = tallies.size();
        Move best = null;
        QualityVector bestQuality = baseline;

        for (int x = 0; x < teamCount; x++) {
            TeamState from = allocation.team(x);
            for (int y = 0; y < teamCount; y++) {
                if (x == y) {
                    continue;
                }
                TeamState to = allocation.team(y);
                for (AtomicGroup g : from.groups()) {
                    if (!to.acceptsWithoutConflict(g, null, conflicts)) {
                        continue;
                    }
                    QualityVector q = evaluateWith(tallies, x, from.tally().minus(g), y, to.tally().plus(g), targets);
                    if (q.isBetterThan(bestQuality)) {
                        bestQuality = q;
                        best = Move.relocation(g, x, y, q);
                    }
                }
            }
        }

        for (int x = 0; x < teamCount; x++) {
            TeamState a = allocation.team(x);
            for (int y = x + 1; y < teamCount; y++) {
                TeamState b = allocation.team(y);
                for (AtomicGroup ga : a.groups()) {
                    for (AtomicGroup gb : b.groups()) {
                        if (!a.acceptsWithoutConflict(gb, ga, conflicts)
                                || !b.acceptsWithoutConflict(ga, gb, conflicts)) {
                            continue;
                        }
                        QualityVector q = evaluateWith(tallies,
                                x, a.tally().minus(ga).plus(gb),
                                y, b.tally().minus(gb).plus(ga), targets);
                        if (q.isBetterThan(bestQuality)) {
                            bestQuality = q;
                            best = Move.swap(ga, x, gb, y, q);
                        }
                    }
                }
            }
        }
        return best;
    }

    private QualityVector evaluateWith(List<TeamTally> tallies, int x, TeamTally newX, int y, TeamTally newY,
                                       TargetDistribution targets) {
        List<TeamTally> candidate = new ArrayList<>(tallies);
        candidate.set(x, newX);
        candidate.set(y, newY);
        return evaluator.evaluate(candidate, targets);
    }

    public record Refinement(Allocation allocation, QualityVector quality, int iterations) { }

    private record Move(AtomicGroup first, int firstTeam, AtomicGroup second, int secondTeam, QualityVector result) {

        static Move relocation(AtomicGroup group, int from, int to, QualityVector result) {
            return new Move(group, from, null, to, result);
        }

        static Move swap(AtomicGroup a, int teamOfA, AtomicGroup b, int teamOfB, QualityVector result) {
            return new Move(a, teamOfA, b, teamOfB, result);
        }

        void applyTo(Allocation allocation) {
            if (second == null) {
                allocation.relocate(first, firstTeam, secondTeam);
            } else {
                allocation.swap(first, firstTeam, second, secondTeam);
            }
        }
    }
}
