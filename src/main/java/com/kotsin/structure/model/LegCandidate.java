package com.kotsin.structure.model;

import com.kotsin.structure.frame.ReferenceFrame;

/**
 * A paired origin/pivot that has not yet passed the creation checks.
 */
public record LegCandidate(Direction direction,
                           double originPrice, int originIndex,
                           double pivotPrice, int pivotIndex) {

    public double range() {
        return Math.abs(pivotPrice - originPrice);
    }

    public ReferenceFrame frame() {
        return new ReferenceFrame(originPrice, pivotPrice);
    }

    /**
     * Pivot beyond origin in the leg's direction, pivot after origin in time.
     */
    public boolean isWellFormed() {
        if (pivotIndex <= originIndex) {
            return false;
        }
        return direction == Direction.BULL ? pivotPrice > originPrice : pivotPrice < originPrice;
    }
}
