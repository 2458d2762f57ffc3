package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.pruner.PruneDecision;
import com.kotsin.structure.pruner.PruneRule;

import java.util.ArrayList;
import java.util.List;

/**
 * StalenessRule - an invalidated leg that price has run far past.
 *
 * Once the origin breach reaches staleExtension x range the leg can no
 * longer matter structurally and leaves the arena as STALE.
 */
public class StalenessRule implements PruneRule {

    @Override
    public String getName() {
        return "STALENESS";
    }

    @Override
    public PruneReason getReason() {
        return PruneReason.STALE;
    }

    @Override
    public List<PruneDecision> evaluate(PruneContext context) {
        double extension = context.getConfig().getStaleExtension();
        List<PruneDecision> decisions = new ArrayList<>();
        for (Leg leg : context.getHierarchy().legs()) {
            if (leg.getStatus() != LegStatus.INVALIDATED) {
                continue;
            }
            double limit = extension * leg.getRange();
            if (leg.getMaxOriginBreach() >= limit) {
                decisions.add(PruneDecision.prune(leg, getReason(),
                        String.format("originBreach=%.4f limit=%.4f", leg.getMaxOriginBreach(), limit)));
            }
        }
        return decisions;
    }
}
