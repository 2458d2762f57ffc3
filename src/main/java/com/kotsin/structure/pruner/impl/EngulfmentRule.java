package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.pruner.PruneDecision;
import com.kotsin.structure.pruner.PruneRule;

import java.util.ArrayList;
import java.util.List;

/**
 * EngulfmentRule - price has traded through both ends of the leg.
 *
 * A formed leg with both breach maxima recorded, where either exceeds
 * engulfmentThreshold x range, is removed. Unformed legs never track a pivot
 * breach, so an invalidated unformed leg is left to staleness.
 */
public class EngulfmentRule implements PruneRule {

    @Override
    public String getName() {
        return "ENGULFMENT";
    }

    @Override
    public PruneReason getReason() {
        return PruneReason.ENGULFED;
    }

    @Override
    public List<PruneDecision> evaluate(PruneContext context) {
        List<PruneDecision> decisions = new ArrayList<>();
        for (Leg leg : context.getHierarchy().legs()) {
            if (isEngulfed(leg, context.getConfig().forDirection(leg.getDirection()).getEngulfmentThreshold())) {
                decisions.add(PruneDecision.prune(leg, getReason(), String.format(
                        "originBreach=%.4f pivotBreach=%.4f limit=%.4f",
                        leg.getMaxOriginBreach(), leg.getMaxPivotBreach(),
                        leg.getRange() * context.getConfig().forDirection(leg.getDirection()).getEngulfmentThreshold())));
            }
        }
        return decisions;
    }

    public static boolean isEngulfed(Leg leg, double thresholdRatio) {
        if (!leg.isFormed() || leg.getMaxOriginBreach() == null || leg.getMaxPivotBreach() == null) {
            return false;
        }
        double limit = thresholdRatio * leg.getRange();
        return Math.max(leg.getMaxOriginBreach(), leg.getMaxPivotBreach()) > limit;
    }
}
