package com.example.teambalancer.allocation;

import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.grouping.GroupConflictGraph;
import com.example.teambalancer.roster.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * One randomized construction pass. Groups are shuffled, then stably ordered so
 * the most constrained go first, and each is placed in the eligible team with
 * the lowest penalty. Teams are filled up to their target size; a cohesion
 * group that fits nowhere goes to the team it overfills least badly.
 */
public class RandomizedGreedyAssigner {

    static final double SKILL_WEIGHT = 1.3;
    static final double CATEGORY_OVERFILL_WEIGHT = 8.0;
    static final double CATEGORY_UNDERFILL_WEIGHT = 0.4;
    static final double TIE_TOLERANCE = 1e-4;

    /**
     * @return the allocation, or empty when some group had no conflict-free team
     */
    public Optional<Allocation> assign(List<AtomicGroup> groups,
                                       GroupConflictGraph conflicts,
                                       TargetDistribution targets,
                                       Random random) {
        List<AtomicGroup> order = new ArrayList<>(groups);
        Collections.shuffle(order, random);
        order.sort(Comparator
                .comparingInt((AtomicGroup g) -> conflicts.degree(g.id())).reversed()
                .thenComparing(Comparator.comparingInt(AtomicGroup::size).reversed())
                .thenComparing(Comparator.comparingInt(AtomicGroup::skillSum).reversed()));

        List<TeamState> teams = new ArrayList<>(targets.teamCount());
        for (int i = 0; i < targets.teamCount(); i++) {
            teams.add(new TeamState(i));
        }

        double idealSkill = targets.idealSkillPerTeam();
        for (AtomicGroup group : order) {
            int teamIndex = pickTeam(group, teams, conflicts, targets, idealSkill, random);
            if (teamIndex < 0) {
                return Optional.empty();
            }
            teams.get(teamIndex).add(group);
        }
        return Optional.of(new Allocation(teams));
    }

    private int pickTeam(AtomicGroup group, List<TeamState> teams, GroupConflictGraph conflicts,
                         TargetDistribution targets, double idealSkill, Random random) {
        int picked = pickTeam(group, teams, conflicts, targets, idealSkill, random, false);
        if (picked < 0 && mayOverflow(group, teams, targets)) {
            picked = pickTeam(group, teams, conflicts, targets, idealSkill, random, true);
        }
        return picked;
    }

    /**
     * A team may grow past its target only for a cohesion group, or once every
     * team is full because such a group already overflowed.
     */
    private boolean mayOverflow(AtomicGroup group, List<TeamState> teams, TargetDistribution targets) {
        if (group.size() > 1) {
            return true;
        }
        return teams.stream().noneMatch(t -> t.size() < targets.targetSize(t.index()));
    }

    private int pickTeam(AtomicGroup group, List<TeamState> teams, GroupConflictGraph conflicts,
                         TargetDistribution targets, double idealSkill, Random random, boolean overflow) {
        double bestScore = Double.POSITIVE_INFINITY;
        List<Integer> best = new ArrayList<>();
        for (TeamState team : teams) {
            int i = team.index();
            if (!overflow && targets.targetSize(i) - team.size() < group.size()) {
                continue;
            }
            if (!team.acceptsWithoutConflict(group, null, conflicts)) {
                continue;
            }
            double score = penalty(team.tally(), group, i, targets, idealSkill);
            if (score < bestScore) {
                bestScore = score;
                best.clear();
                best.add(i);
                continue;
            }
            if (Math.abs(score - bestScore) < TIE_TOLERANCE) {
                best.add(i);
            }
        }
        if (best.isEmpty()) {
            return -1;
        }
        return best.get(random.nextInt(best.size()));
    }

    double penalty(TeamTally team, AtomicGroup group, int teamIndex, TargetDistribution targets, double idealSkill) {
        double skillPenalty = Math.abs(team.skillSum() + group.skillSum() - idealSkill);
        double fillRatio = (double) (team.size() + group.size()) / targets.targetSize(teamIndex);

        double categoryPenalty = 0;
        for (Category c : Category.values()) {
            int adding = group.categoryCount(c);
            if (!c.isBalanced() || adding == 0) {
                continue;
            }
            int projected = team.categoryCount(c) + adding;
            int target = targets.targetCategoryCount(c, teamIndex);
            if (projected > target) {
                categoryPenalty += (projected - target) * CATEGORY_OVERFILL_WEIGHT;
            } else {
                categoryPenalty += (target - projected) * CATEGORY_UNDERFILL_WEIGHT;
            }
        }
        return skillPenalty * SKILL_WEIGHT + fillRatio + categoryPenalty;
    }
}
