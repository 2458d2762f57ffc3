package com.kotsin.structure.detector;

import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.event.StructureEventType;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fibonacci band tracking for ACTIVE swings.
 *
 * The band of a close is the highest of {@link #BANDS} at or below its ratio
 * in the swing frame (0 = origin, 1 = pivot); anything below the origin is
 * band 0. A close landing in a different band than the last recorded one
 * emits LEVEL_CROSS. A swing's first band is taken from its formation close.
 */
@Slf4j
public class LevelCrossTracker {

    public static final double[] BANDS = {0.0, 0.382, 0.5, 0.618, 1.0, 1.382, 1.618, 2.0};

    private static final double EPSILON = 1e-9;

    private final LegHierarchy hierarchy;

    // Swing (leg id) -> last band
    private final TreeMap<Long, Double> bands = new TreeMap<>();

    public LevelCrossTracker(LegHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    public void onSwingFormed(Swing swing, double close) {
        bands.put(swing.getLegId(), bandOf(swing, close));
    }

    public List<StructureEvent> track(Bar bar) {
        bands.keySet().removeIf(legId -> hierarchy.swing(legId) == null);

        List<StructureEvent> events = new ArrayList<>();
        for (Swing swing : hierarchy.swings()) {
            if (swing.getStatus() != SwingStatus.ACTIVE) {
                continue;
            }
            double band = bandOf(swing, bar.getClose());
            Double previous = bands.put(swing.getLegId(), band);
            if (previous == null || previous == band) {
                continue;
            }

            Leg leg = hierarchy.get(swing.getLegId());
            StructureEvent event = StructureEvent.of(StructureEventType.LEVEL_CROSS, leg,
                    bar.getIndex(), bar.getTimestamp());
            event.setPrice(bar.getClose());
            event.setLevel(band);
            event.setPreviousLevel(previous);
            event.setDetail(band > previous ? "UP" : "DOWN");
            events.add(event);

            log.debug("Swing {} crossed {} -> {} at bar {} close={}",
                    swing.getLegId(), previous, band, bar.getIndex(), bar.getClose());
        }
        return events;
    }

    static double bandOf(Swing swing, double price) {
        double ratio = new ReferenceFrame(swing.getOriginPrice(), swing.getPivotPrice()).ratio(price);
        double band = BANDS[0];
        for (double level : BANDS) {
            if (ratio + EPSILON < level) {
                break;
            }
            band = level;
        }
        return band;
    }

    /**
     * @return copy of the last band per swing, keyed by leg id
     */
    public Map<Long, Double> getBands() {
        return new TreeMap<>(bands);
    }

    public void restore(Map<Long, Double> restored) {
        bands.clear();
        bands.putAll(restored);
    }
}
