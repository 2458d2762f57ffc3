package com.kotsin.structure.stats;

import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scale statistics backing big-swing classification and impulsiveness.
 *
 * Two populations:
 * 1. Live ranges per direction - follow the arena (created, extended, removed).
 * 2. Formed population - impulse of every leg at the bar it formed.
 *    Frozen once recorded; carried in snapshots.
 */
public class ScaleStatistics {

    private final Map<Direction, SortedSample> liveRanges = new EnumMap<>(Direction.class);
    private final SortedSample formedImpulses = new SortedSample();

    public ScaleStatistics() {
        for (Direction d : Direction.values()) {
            liveRanges.put(d, new SortedSample());
        }
    }

    // ========== Live population ==========

    public void onLegCreated(Leg leg) {
        liveRanges.get(leg.getDirection()).add(leg.getRange());
    }

    public void onRangeChanged(Leg leg, double previousRange) {
        liveRanges.get(leg.getDirection()).replace(previousRange, leg.getRange());
    }

    public void onLegRemoved(Leg leg) {
        liveRanges.get(leg.getDirection()).remove(leg.getRange());
    }

    /**
     * A leg is big when fewer than ceil(fraction x n) live legs of its
     * direction have a strictly larger range. With any live legs at all,
     * the largest one is always big.
     */
    public boolean isBig(Leg leg, double topFraction) {
        SortedSample sample = liveRanges.get(leg.getDirection());
        int n = sample.size();
        if (n == 0) {
            return false;
        }
        int slots = (int) Math.ceil(topFraction * n);
        return sample.countAbove(leg.getRange()) < slots;
    }

    public int liveCount(Direction direction) {
        return liveRanges.get(direction).size();
    }

    // ========== Formed population ==========

    public void onLegFormed(Leg leg) {
        formedImpulses.add(leg.getImpulse());
    }

    /**
     * Percentile rank (0-100) of an impulse against the formed population.
     *
     * @return null while no leg has formed
     */
    public Double impulsiveness(double impulse) {
        return formedImpulses.percentileRank(impulse);
    }

    public List<Double> formedImpulses() {
        return formedImpulses.toList();
    }

    public int formedCount() {
        return formedImpulses.size();
    }

    // ========== Restore ==========

    public void restore(Collection<Double> impulses, Collection<Leg> liveLegs) {
        formedImpulses.clear();
        liveRanges.values().forEach(SortedSample::clear);

        formedImpulses.addAll(impulses);
        for (Leg leg : liveLegs) {
            if (leg.isLive()) {
                onLegCreated(leg);
            }
        }
    }
}
