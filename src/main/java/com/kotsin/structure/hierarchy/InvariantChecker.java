package com.kotsin.structure.hierarchy;

import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.exception.InvariantViolationException;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingStatus;

/**
 * Post-bar verification of the arena. Any failure is a programming defect.
 *
 * Checks, beyond {@link LegHierarchy#verifyIntegrity()}:
 * - a leg is INVALIDATED exactly when its origin breach is recorded
 * - a pivot breach is only recorded on a formed leg with an origin breach
 * - formed legs carry a swing, unformed legs do not
 * - swing status mirrors the leg
 * - no engulfed leg survived the bar
 */
public class InvariantChecker {

    private final DetectionConfig config;

    public InvariantChecker(DetectionConfig config) {
        this.config = config;
    }

    public void verify(LegHierarchy hierarchy, int barIndex) {
        hierarchy.verifyIntegrity();

        for (Leg leg : hierarchy.legs()) {
            boolean invalidated = leg.getStatus() == LegStatus.INVALIDATED;
            if (invalidated != leg.isOriginBreached()) {
                fail(barIndex, leg, "status " + leg.getStatus() + " with origin breach " + leg.getMaxOriginBreach());
            }
            if (leg.getMaxPivotBreach() != null && (!leg.isOriginBreached() || !leg.isFormed())) {
                fail(barIndex, leg, "pivot breach on a leg without origin breach or not formed");
            }

            Swing swing = hierarchy.swing(leg.getId());
            if (leg.isFormed() != (swing != null)) {
                fail(barIndex, leg, "formed=" + leg.isFormed() + " but swing " + (swing == null ? "missing" : "present"));
            }
            if (swing != null) {
                SwingStatus expected = invalidated ? SwingStatus.INVALIDATED : SwingStatus.ACTIVE;
                if (swing.getStatus() != expected) {
                    fail(barIndex, leg, "swing status " + swing.getStatus() + " does not mirror " + leg.getStatus());
                }
            }

            if (leg.getMaxOriginBreach() != null && leg.getMaxPivotBreach() != null) {
                double limit = config.forDirection(leg.getDirection()).getEngulfmentThreshold() * leg.getRange();
                if (Math.max(leg.getMaxOriginBreach(), leg.getMaxPivotBreach()) > limit) {
                    fail(barIndex, leg, "engulfed leg survived pruning");
                }
            }
        }
    }

    private static void fail(int barIndex, Leg leg, String what) {
        throw new InvariantViolationException("Bar " + barIndex + ", leg " + leg.getId() + ": " + what);
    }
}
