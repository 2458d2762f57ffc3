package com.kotsin.structure.model;

/**
 * Leg direction.
 *
 * BULL: origin at a LOW, pivot at a HIGH (upward move)
 * BEAR: origin at a HIGH, pivot at a LOW (downward move)
 *
 * Direction only decides which price series of a bar feeds a reference frame.
 * All ratio math downstream is direction-agnostic.
 */
public enum Direction {
    BULL,
    BEAR;

    /**
     * Extreme in the direction of the move (high for bull, low for bear).
     */
    public double favorableExtreme(Bar bar) {
        return this == BULL ? bar.getHigh() : bar.getLow();
    }

    /**
     * Extreme against the move (low for bull, high for bear).
     */
    public double adverseExtreme(Bar bar) {
        return this == BULL ? bar.getLow() : bar.getHigh();
    }

    public Direction opposite() {
        return this == BULL ? BEAR : BULL;
    }
}
