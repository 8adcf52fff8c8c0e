package com.example.teambalancer.allocation;

import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.roster.Category;
import com.example.teambalancer.roster.Member;

/**
 * Immutable running totals of one team. {@link #plus} and {@link #minus}
 * return updated copies.
 */
public final class TeamTally {

    public static final TeamTally EMPTY =
            new TeamTally(0, 0, new int[Member.MAX_LEVEL + 1], new int[Category.values().length]);

    private final int size;
    private final int skillSum;
    private final int[] levelCounts;
    private final int[] categoryCounts;

    private TeamTally(int size, int skillSum, int[] levelCounts, int[] categoryCounts) {
        this.size = size;
        this.skillSum = skillSum;
        this.levelCounts = levelCounts;
        this.categoryCounts = categoryCounts;
    }

    public TeamTally plus(AtomicGroup group) {
        return apply(group, 1);
    }

    public TeamTally minus(AtomicGroup group) {
        return apply(group, -1);
    }

    private TeamTally apply(AtomicGroup group, int sign) {
        int[] levels = levelCounts.clone();
        for (int l = Member.MIN_LEVEL; l <= Member.MAX_LEVEL; l++) {
            levels[l] += sign * group.levelCount(l);
        }
        int[] categories = categoryCounts.clone();
        for (Category c : Category.values()) {
            categories[c.ordinal()] += sign * group.categoryCount(c);
        }
        return new TeamTally(size + sign * group.size(), skillSum + sign * group.skillSum(), levels, categories);
    }

    public int size() {
        return size;
    }

    public int skillSum() {
        return skillSum;
    }

    public int levelCount(int level) {
        return levelCounts[level];
    }

    public int categoryCount(Category category) {
        return categoryCounts[category.ordinal()];
    }
}
