package com.kotsin.structure.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-direction detection parameters.
 *
 * structure:
 *   detection:
 *     bull:
 *       formation-threshold: 0.382
 *       ...
 *     bear:
 *       ...
 */
@Data
@NoArgsConstructor
public class DirectionConfig {

    // ========== Formation ==========

    /**
     * Retracement from the pivot (at the close) at which a leg forms.
     */
    private double formationThreshold = 0.382;

    // ========== Creation ==========

    /**
     * Minimum origin distance, as a fraction of the candidate's range, from an
     * ACTIVE same-direction leg sharing its pivot.
     */
    private double selfSeparation = 0.10;

    /**
     * Minimum origin distance, as a fraction of the parent's range, between a
     * candidate and its parent.
     */
    private double parentChildSeparation = 0.10;

    // ========== Graduated invalidation ==========

    /**
     * Top fraction of live same-direction legs (by range) treated as big.
     */
    private double bigSwingThreshold = 0.10;

    /**
     * Wick tolerance past the origin for big formed legs (fraction of range).
     */
    private double bigSwingWickTolerance = 0.15;

    /**
     * Close tolerance past the origin for big formed legs (fraction of range).
     */
    private double bigSwingCloseTolerance = 0.10;

    /**
     * Close tolerance for formed legs one or two levels below a big leg.
     */
    private double childSwingTolerance = 0.10;

    // ========== Pruning ==========

    /**
     * A leg with both breaches recorded is engulfed once either exceeds
     * this fraction of its range.
     */
    private double engulfmentThreshold = 0.236;

    /**
     * Counter-direction legs kept per turn.
     */
    private int maxLegsPerTurn = 10;

    /**
     * Origin distance (fraction of the larger range) under which legs sharing
     * a pivot are treated as duplicates.
     */
    private double proximityTolerance = 0.02;

    private boolean innerStructureEnabled = false;

    public DirectionConfig copy() {
        DirectionConfig copy = new DirectionConfig();
        copy.setFormationThreshold(formationThreshold);
        copy.setSelfSeparation(selfSeparation);
        copy.setParentChildSeparation(parentChildSeparation);
        copy.setBigSwingThreshold(bigSwingThreshold);
        copy.setBigSwingWickTolerance(bigSwingWickTolerance);
        copy.setBigSwingCloseTolerance(bigSwingCloseTolerance);
        copy.setChildSwingTolerance(childSwingTolerance);
        copy.setEngulfmentThreshold(engulfmentThreshold);
        copy.setMaxLegsPerTurn(maxLegsPerTurn);
        copy.setProximityTolerance(proximityTolerance);
        copy.setInnerStructureEnabled(innerStructureEnabled);
        return copy;
    }

    void collectErrors(String prefix, List<String> errors) {
        if (!(formationThreshold > 0 && formationThreshold <= 1)) {
            errors.add(prefix + ".formation-threshold must be in (0, 1], got " + formationThreshold);
        }
        requireFraction(prefix + ".self-separation", selfSeparation, errors);
        requireFraction(prefix + ".parent-child-separation", parentChildSeparation, errors);
        if (!(bigSwingThreshold > 0 && bigSwingThreshold <= 1)) {
            errors.add(prefix + ".big-swing-threshold must be in (0, 1], got " + bigSwingThreshold);
        }
        requireNonNegative(prefix + ".big-swing-wick-tolerance", bigSwingWickTolerance, errors);
        requireNonNegative(prefix + ".big-swing-close-tolerance", bigSwingCloseTolerance, errors);
        requireNonNegative(prefix + ".child-swing-tolerance", childSwingTolerance, errors);
        if (!(engulfmentThreshold > 0) || !Double.isFinite(engulfmentThreshold)) {
            errors.add(prefix + ".engulfment-threshold must be positive, got " + engulfmentThreshold);
        }
        if (maxLegsPerTurn < 1) {
            errors.add(prefix + ".max-legs-per-turn must be at least 1, got " + maxLegsPerTurn);
        }
        requireFraction(prefix + ".proximity-tolerance", proximityTolerance, errors);
    }

    private static void requireFraction(String name, double value, List<String> errors) {
        if (!(value >= 0 && value <= 1)) {
            errors.add(name + " must be in [0, 1], got " + value);
        }
    }

    private static void requireNonNegative(String name, double value, List<String> errors) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            errors.add(name + " must be a finite non-negative number, got " + value);
        }
    }
}
