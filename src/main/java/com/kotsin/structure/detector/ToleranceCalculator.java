package com.kotsin.structure.detector;

import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.config.DirectionConfig;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.stats.ScaleStatistics;

/**
 * Graduated origin-breach tolerance.
 *
 * UNFORMED / STANDARD : close past the origin
 * BIG                 : wick past bigSwingWickTolerance OR close past bigSwingCloseTolerance
 * CHILD_OF_BIG        : close past childSwingTolerance
 *
 * Tolerances are fractions of the leg's range, measured in its frame.
 */
public class ToleranceCalculator {

    private static final int BIG_ANCESTOR_LEVELS = 2;

    private final DetectionConfig config;
    private final LegHierarchy hierarchy;
    private final ScaleStatistics statistics;

    public ToleranceCalculator(DetectionConfig config, LegHierarchy hierarchy, ScaleStatistics statistics) {
        this.config = config;
        this.hierarchy = hierarchy;
        this.statistics = statistics;
    }

    public ToleranceTier tierOf(Leg leg) {
        if (!leg.isFormed()) {
            return ToleranceTier.UNFORMED;
        }
        DirectionConfig dc = config.forDirection(leg.getDirection());
        if (statistics.isBig(leg, dc.getBigSwingThreshold())) {
            return ToleranceTier.BIG;
        }
        Long ancestorId = leg.getParentId();
        for (int level = 0; level < BIG_ANCESTOR_LEVELS && ancestorId != null; level++) {
            Leg ancestor = hierarchy.get(ancestorId);
            if (ancestor == null) {
                break;
            }
            if (ancestor.isLive() && statistics.isBig(ancestor, dc.getBigSwingThreshold())) {
                return ToleranceTier.CHILD_OF_BIG;
            }
            ancestorId = ancestor.getParentId();
        }
        return ToleranceTier.STANDARD;
    }

    public boolean isOriginBreached(Leg leg, Bar bar, ToleranceTier tier) {
        ReferenceFrame frame = leg.frame();
        DirectionConfig dc = config.forDirection(leg.getDirection());
        switch (tier) {
            case BIG:
                return frame.isViolated(leg.getDirection().adverseExtreme(bar), dc.getBigSwingWickTolerance())
                        || frame.isViolated(bar.getClose(), dc.getBigSwingCloseTolerance());
            case CHILD_OF_BIG:
                return frame.isViolated(bar.getClose(), dc.getChildSwingTolerance());
            case UNFORMED:
            case STANDARD:
            default:
                return frame.isViolated(bar.getClose(), 0.0);
        }
    }
}
