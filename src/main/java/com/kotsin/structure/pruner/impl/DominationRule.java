package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegCandidate;

/**
 * DominationRule - creation-time veto, never prunes an existing leg.
 *
 * A candidate is dominated when a live leg of the same direction already
 * starts at the same origin bar and price with a range at least as large.
 */
public class DominationRule {

    public String getName() {
        return "DOMINATION";
    }

    /**
     * @return the dominating leg, or null when the candidate may proceed
     */
    public Leg findDominator(LegCandidate candidate, LegHierarchy hierarchy) {
        for (Leg leg : hierarchy.liveLegs(candidate.direction())) {
            if (leg.getOriginIndex() == candidate.originIndex()
                    && leg.getOriginPrice() == candidate.originPrice()
                    && leg.getRange() >= candidate.range()) {
                return leg;
            }
        }
        return null;
    }
}
