package com.example.teambalancer.allocation;

import java.util.Comparator;

/**
 * Balance score of an allocation, compared lexicographically in declaration
 * order. Smaller is better; {@link #ZERO} is a perfect split. Team sizes come
 * first, so an uneven split forced by cohesion groups never beats an even one.
 */
public record QualityVector(int sizeDeviation,
                            int levelCountGap,
                            int levelCountDeviation,
                            int skillSumRange,
                            double skillSumDeviation,
                            int categoryDeviation) implements Comparable<QualityVector> {

    public static final QualityVector ZERO = new QualityVector(0, 0, 0, 0, 0.0, 0);

    private static final Comparator<QualityVector> ORDER = Comparator
            .comparingInt(QualityVector::sizeDeviation)
            .thenComparingInt(QualityVector::levelCountGap)
            .thenComparingInt(QualityVector::levelCountDeviation)
            .thenComparingInt(QualityVector::skillSumRange)
            .thenComparingDouble(QualityVector::skillSumDeviation)
            .thenComparingInt(QualityVector::categoryDeviation);

    public QualityVector {
        if (sizeDeviation < 0 || levelCountGap < 0 || levelCountDeviation < 0 || skillSumRange < 0
                || skillSumDeviation < 0 || categoryDeviation < 0) {
            throw new IllegalArgumentException("quality components must be non-negative");
        }
    }

    @Override
    public int compareTo(QualityVector other) {
        return ORDER.compare(this, other);
    }

    public boolean isBetterThan(QualityVector other) {
        return compareTo(other) < 0;
    }

    public boolean isPerfect() {
        return compareTo(ZERO) == 0;
    }
}
