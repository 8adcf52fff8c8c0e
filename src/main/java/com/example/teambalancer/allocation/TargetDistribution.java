package com.example.teambalancer.allocation;

import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;

import java.util.Arrays;

/**
 * Ideal per-team split of team size, category counts and level counts.
 * Arrays are indexed by team; the first {@code total mod teamCount} teams get
 * the extra unit.
 */
public final class TargetDistribution {

    private final int teamCount;
    private final int[] sizes;
    private final int[][] categoryTargets;
    private final int[][] levelTargets;
    private final int[] categoryTotals;
    private final int[] levelTotals;
    private final int totalSkill;

    TargetDistribution(int teamCount, int[] sizes, int[][] categoryTargets, int[][] levelTargets,
                       int[] categoryTotals, int[] levelTotals, int totalSkill) {
        this.teamCount = teamCount;
        this.sizes = sizes;
        this.categoryTargets = categoryTargets;
        this.levelTargets = levelTargets;
        this.categoryTotals = categoryTotals;
        this.levelTotals = levelTotals;
        this.totalSkill = totalSkill;
    }

    public int teamCount() {
        return teamCount;
    }

    public int targetSize(int team) {
        return sizes[team];
    }

    public int maxTargetSize() {
        return Arrays.stream(sizes).max().orElse(0);
    }

    public int targetCategoryCount(Category category, int team) {
        return categoryTargets[category.ordinal()][team];
    }

    int targetLevelCount(int level, int team) {
        return levelTargets[level][team];
    }

    public int categoryTotal(Category category) {
        return categoryTotals[category.ordinal()];
    }

    public int levelTotal(int level) {
        return levelTotals[level];
    }

    public int totalSkill() {
        return totalSkill;
    }

    public int presentCount() {
        return Arrays.stream(sizes).sum();
    }

    public double idealSkillPerTeam() {
        return (double) totalSkill / teamCount;
    }

    public static int[] levels() {
        int[] levels = new int[Member.MAX_LEVEL - Member.MIN_LEVEL + 1];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = Member.MIN_LEVEL + i;
        }
        return levels;
    }
}
