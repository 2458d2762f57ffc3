package com.kotsin.structure.frame;

import com.kotsin.structure.model.Leg;

/**
 * ReferenceFrame - oriented ratio coordinates between two anchors.
 *
 * anchor0 = defended price (ratio 0), anchor1 = opposite extremum (ratio 1).
 * The sign of (anchor1 - anchor0) carries direction, so bull and bear legs
 * share every formula below.
 *
 * For a leg the frame is (origin, pivot):
 *   0 = origin, 1 = pivot, 2 = completion target.
 */
public final class ReferenceFrame {

    private final double anchor0;
    private final double anchor1;
    private final double span;

    public ReferenceFrame(double anchor0, double anchor1) {
        if (!Double.isFinite(anchor0) || !Double.isFinite(anchor1)) {
            throw new IllegalArgumentException("Frame anchors must be finite: " + anchor0 + ", " + anchor1);
        }
        if (anchor0 == anchor1) {
            throw new IllegalArgumentException("Degenerate frame: anchor0 == anchor1 == " + anchor0);
        }
        this.anchor0 = anchor0;
        this.anchor1 = anchor1;
        this.span = anchor1 - anchor0;
    }

    public static ReferenceFrame of(Leg leg) {
        return new ReferenceFrame(leg.getOriginPrice(), leg.getPivotPrice());
    }

    public double ratio(double price) {
        return (price - anchor0) / span;
    }

    public double price(double ratio) {
        return anchor0 + ratio * span;
    }

    /**
     * True when price sits more than {@code tolerance} (in range units) past anchor0.
     */
    public boolean isViolated(double price, double tolerance) {
        return ratio(price) < -tolerance;
    }

    /**
     * Retracement measured back from anchor1: 0 at the extremum, 1 at the defended level.
     */
    public double retracement(double price) {
        return 1.0 - ratio(price);
    }

    /**
     * Absolute distance past anchor0, away from anchor1. Zero when not past it.
     */
    public double beyondAnchor0(double price) {
        return ratio(price) < 0 ? Math.abs(price - anchor0) : 0.0;
    }

    /**
     * Absolute distance past anchor1, away from anchor0. Zero when not past it.
     */
    public double beyondAnchor1(double price) {
        return ratio(price) > 1 ? Math.abs(price - anchor1) : 0.0;
    }

    public double range() {
        return Math.abs(span);
    }

    public double getAnchor0() {
        return anchor0;
    }

    public double getAnchor1() {
        return anchor1;
    }

    @Override
    public String toString() {
        return "ReferenceFrame[" + anchor0 + " -> " + anchor1 + "]";
    }
}
