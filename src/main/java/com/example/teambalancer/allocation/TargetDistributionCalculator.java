package com.example.teambalancer.allocation;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;

import java.util.List;

public class TargetDistributionCalculator {

    public TargetDistribution calculate(List<Member> presentMembers, int teamCount) {
        if (teamCount <= 0) {
            throw new IllegalArgumentException("teamCount must be positive: " + teamCount);
        }
        int[] categoryTotals = new int[Category.values().length];
        int[] levelTotals = new int[Member.MAX_LEVEL + 1];
        int totalSkill = 0;
        for (Member m : presentMembers) {
            categoryTotals[m.category().ordinal()]++;
            levelTotals[m.level()]++;
            totalSkill += m.level();
        }

        int[][] categoryTargets = new int[categoryTotals.length][];
        for (int c = 0; c < categoryTotals.length; c++) {
            categoryTargets[c] = split(categoryTotals[c], teamCount);
        }
        int[][] levelTargets = new int[levelTotals.length][];
        for (int l = 0; l < levelTotals.length; l++) {
            levelTargets[l] = split(levelTotals[l], teamCount);
        }
        return new TargetDistribution(teamCount, split(presentMembers.size(), teamCount),
                categoryTargets, levelTargets, categoryTotals, levelTotals, totalSkill);
    }

    /**
     * Splits {@code total} into {@code buckets} parts, {@code total / buckets}
     * each, with one extra for the first {@code total % buckets} buckets.
     */
    public static int[] split(int total, int buckets) {
        int base = total / buckets;
        int remainder = total % buckets;
        int[] result = new int[buckets];
        for (int i = 0; i < buckets; i++) {
            result[i] = i < remainder ? base + 1 : base;
        }
        return result;
    }
}
