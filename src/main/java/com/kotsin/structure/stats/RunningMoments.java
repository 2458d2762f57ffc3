package com.kotsin.structure.stats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * O(1)-space running moments (count, sum, sum^2, sum^3) of a leg's per-bar
 * contributions. Used for the spikiness score.
 *
 * Spikiness = 100 / (1 + e^-skew), Fisher skewness from the raw moments.
 *  - 50  = symmetric (move evenly distributed)
 *  - 90+ = a few outlier bars drove the move
 *  - 10- = very smooth
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunningMoments {

    private static final int MIN_SAMPLES = 3;
    private static final double MIN_VARIANCE = 1e-10;
    public static final double NEUTRAL_SPIKINESS = 50.0;

    private int count;
    private double sumX;
    private double sumX2;
    private double sumX3;

    public void add(double x) {
        count++;
        sumX += x;
        sumX2 += x * x;
        sumX3 += x * x * x;
    }

    /**
     * @return spikiness in [0, 100], or null below three samples
     */
    public Double spikiness() {
        if (count < MIN_SAMPLES) {
            return null;
        }
        double mean = sumX / count;
        double variance = (sumX2 / count) - mean * mean;
        if (variance < MIN_VARIANCE) {
            return NEUTRAL_SPIKINESS;
        }
        double stdDev = Math.sqrt(variance);
        // E[(X - mu)^3] = E[X^3] - 3 mu E[X^2] + 2 mu^3
        double thirdMoment = (sumX3 / count) - 3 * mean * (sumX2 / count) + 2 * mean * mean * mean;
        double skewness = thirdMoment / (stdDev * stdDev * stdDev);
        return 100.0 / (1.0 + Math.exp(-skewness));
    }

    public RunningMoments copy() {
        return new RunningMoments(count, sumX, sumX2, sumX3);
    }
}
