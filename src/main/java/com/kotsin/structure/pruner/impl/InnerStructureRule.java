package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.pruner.PruneDecision;
import com.kotsin.structure.pruner.PruneRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * InnerStructureRule - legs fully nested inside a larger accepted leg.
 *
 * Off by default (innerStructureEnabled per direction). An ACTIVE unformed
 * leg is pruned when an older, larger, live leg of the same direction
 * strictly contains it in price and in time.
 */
public class InnerStructureRule implements PruneRule {

    @Override
    public String getName() {
        return "INNER_STRUCTURE";
    }

    @Override
    public PruneReason getReason() {
        return PruneReason.INNER_STRUCTURE;
    }

    @Override
    public List<PruneDecision> evaluate(PruneContext context) {
        List<PruneDecision> decisions = new ArrayList<>();
        Set<Long> pruned = new HashSet<>();
        List<Leg> legs = new ArrayList<>(context.getHierarchy().legs());

        for (Leg inner : legs) {
            if (!inner.isActive() || inner.isFormed()
                    || !context.getConfig().forDirection(inner.getDirection()).isInnerStructureEnabled()) {
                continue;
            }
            for (Leg outer : legs) {
                if (outer.getId() >= inner.getId()) {
                    break;
                }
                if (pruned.contains(outer.getId()) || !outer.isLive()
                        || outer.getDirection() != inner.getDirection()
                        || outer.getRange() <= inner.getRange()) {
                    continue;
                }
                if (contains(outer, inner)) {
                    pruned.add(inner.getId());
                    decisions.add(PruneDecision.prune(inner, getReason(), "inside leg " + outer.getId()));
                    break;
                }
            }
        }
        return decisions;
    }

    static boolean contains(Leg outer, Leg inner) {
        ReferenceFrame frame = outer.frame();
        double o = frame.ratio(inner.getOriginPrice());
        double p = frame.ratio(inner.getPivotPrice());
        boolean inPrice = o > 0 && o < 1 && p > 0 && p < 1;
        boolean inTime = outer.getOriginIndex() < inner.getOriginIndex()
                && inner.getPivotIndex() < outer.getPivotIndex();
        return inPrice && inTime;
    }
}
