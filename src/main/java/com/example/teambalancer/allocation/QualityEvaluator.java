package com.example.teambalancer.allocation;

import com.example.teambalancer.roster.Category;

import java.util.List;

public class QualityEvaluator {

    public QualityVector evaluate(Allocation allocation, TargetDistribution targets) {
        return evaluate(allocation.tallies(), targets);
    }

    /**
     * Team sizes, level and category counts are judged against the index-free band
     * [floor(T/K), ceil(T/K)]; the gap term only counts spread beyond the one
     * unit an uneven total forces.
     */
    public QualityVector evaluate(List<TeamTally> tallies, TargetDistribution targets) {
        int k = tallies.size();

        int sizeDeviation = 0;
        for (TeamTally t : tallies) {
            sizeDeviation += outsideBand(t.size(), targets.presentCount(), k);
        }

        int levelGap = 0;
        int levelDeviation = 0;
        for (int level : TargetDistribution.levels()) {
            int total = targets.levelTotal(level);
            int min = Integer.MAX_VALUE;
            int max = Integer.MIN_VALUE;
            for (TeamTally t : tallies) {
                int count = t.levelCount(level);
                min = Math.min(min, count);
                max = Math.max(max, count);
                levelDeviation += outsideBand(count, total, k);
            }
            int unavoidable = total % k == 0 ? 0 : 1;
            levelGap += Math.max(0, (max - min) - unavoidable);
        }

        int minSkill = Integer.MAX_VALUE;
        int maxSkill = Integer.MIN_VALUE;
        long scaledDeviation = 0;
        for (TeamTally t : tallies) {
            minSkill = Math.min(minSkill, t.skillSum());
            maxSkill = Math.max(maxSkill, t.skillSum());
            // |s - total/k| * k kept integral so equal splits compare exactly
            scaledDeviation += Math.abs((long) t.skillSum() * k - targets.totalSkill());
        }

        int categoryDeviation = 0;
        for (Category c : Category.values()) {
            if (!c.isBalanced()) {
                continue;
            }
            int total = targets.categoryTotal(c);
            for (TeamTally t : tallies) {
                categoryDeviation += outsideBand(t.categoryCount(c), total, k);
            }
        }

        return new QualityVector(sizeDeviation, levelGap, levelDeviation, maxSkill - minSkill,
                (double) scaledDeviation / k, categoryDeviation);
    }

    private static int outsideBand(int count, int total, int k) {
        int low = total / k;
        int high = total % k == 0 ? low : low + 1;
        if (count < low) {
            return low - count;
        }
        if (count > high) {
            return count - high;
        }
        return 0;
    }
}
