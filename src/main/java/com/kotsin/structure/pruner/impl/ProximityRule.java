package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.pruner.PruneDecision;
import com.kotsin.structure.pruner.PruneRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ProximityRule - near-duplicate legs sharing a pivot.
 *
 * ACTIVE unformed legs of one direction are grouped by pivot bar and visited
 * largest range first. A leg whose origin lies within
 * proximityTolerance x range of an already kept (larger) leg's origin is
 * pruned. Nothing is merged into the kept leg.
 */
public class ProximityRule implements PruneRule {

    private static final Comparator<Leg> LARGEST_FIRST = Comparator
            .comparingDouble(Leg::getRange).reversed()
            .thenComparingLong(Leg::getId);

    @Override
    public String getName() {
        return "PROXIMITY";
    }

    @Override
    public PruneReason getReason() {
        return PruneReason.PROXIMITY;
    }

    @Override
    public List<PruneDecision> evaluate(PruneContext context) {
        List<PruneDecision> decisions = new ArrayList<>();
        for (Direction direction : Direction.values()) {
            double tolerance = context.getConfig().forDirection(direction).getProximityTolerance();

            // Same direction and pivot bar implies the same pivot price
            Map<Integer, List<Leg>> byPivot = new TreeMap<>();
            for (Leg leg : context.getHierarchy().liveLegs(direction)) {
                if (leg.isActive() && !leg.isFormed()) {
                    byPivot.computeIfAbsent(leg.getPivotIndex(), k -> new ArrayList<>()).add(leg);
                }
            }

            for (List<Leg> group : byPivot.values()) {
                if (group.size() < 2) {
                    continue;
                }
                group.sort(LARGEST_FIRST);
                List<Leg> kept = new ArrayList<>();
                for (Leg leg : group) {
                    Leg near = findNear(leg, kept, tolerance);
                    if (near == null) {
                        kept.add(leg);
                    } else {
                        decisions.add(PruneDecision.prune(leg, getReason(), String.format(
                                "origin %.4f within %.4f of leg %d origin %.4f",
                                leg.getOriginPrice(), tolerance * near.getRange(), near.getId(), near.getOriginPrice())));
                    }
                }
            }
        }
        decisions.sort(Comparator.comparingLong(d -> d.getLeg().getId()));
        return decisions;
    }

    private static Leg findNear(Leg leg, List<Leg> kept, double tolerance) {
        for (Leg larger : kept) {
            if (Math.abs(leg.getOriginPrice() - larger.getOriginPrice()) <= tolerance * larger.getRange()) {
                return larger;
            }
        }
        return null;
    }
}
