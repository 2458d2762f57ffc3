package com.kotsin.structure.swing;

import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingStatus;

/**
 * Stateless translation of a newly formed leg into a Swing.
 */
public final class SwingFormer {

    private SwingFormer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Swing form(Leg leg, long timestamp) {
        if (!leg.isFormed()) {
            throw new IllegalArgumentException("Leg " + leg.getId() + " has not formed");
        }
        ReferenceFrame frame = ReferenceFrame.of(leg);
        double[] levels = new double[Swing.LEVEL_RATIOS.length];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = frame.price(Swing.LEVEL_RATIOS[i]);
        }

        return Swing.builder()
                .legId(leg.getId())
                .direction(leg.getDirection())
                .originPrice(leg.getOriginPrice())
                .originIndex(leg.getOriginIndex())
                .pivotPrice(leg.getPivotPrice())
                .pivotIndex(leg.getPivotIndex())
                .formedAtBar(leg.getFormedAtBar())
                .formedAtTimestamp(timestamp)
                .levelPrices(levels)
                .status(leg.getStatus() == LegStatus.INVALIDATED ? SwingStatus.INVALIDATED : SwingStatus.ACTIVE)
                .build();
    }
}
