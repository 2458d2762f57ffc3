package com.kotsin.structure.detector;

import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.event.StructureEventType;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Origin and pivot breach tracking.
 *
 * ACTIVE legs: the first bar trading past the origin emits ORIGIN_BREACHED,
 * whatever the tolerance. The graduated tolerance then decides whether this
 * bar invalidates the leg: the adverse wick distance past the origin is
 * recorded, the pivot freezes and the swing status is mirrored.
 *
 * INVALIDATED legs: running maximum of the origin breach. Formed legs also
 * track the breach of their frozen pivot; the first one emits PIVOT_BREACHED.
 * Unformed legs never track it, so they cannot be engulfed.
 */
@Slf4j
public class BreachTracker {

    private final LegHierarchy hierarchy;
    private final ToleranceCalculator tolerance;

    public BreachTracker(LegHierarchy hierarchy, ToleranceCalculator tolerance) {
        this.hierarchy = hierarchy;
        this.tolerance = tolerance;
    }

    public List<StructureEvent> track(Bar bar) {
        // Tiers first, so classification never depends on visiting order
        Map<Leg, ToleranceTier> tiers = new LinkedHashMap<>();
        for (Leg leg : hierarchy.legs()) {
            if (leg.isActive()) {
                tiers.put(leg, tolerance.tierOf(leg));
            }
        }

        List<StructureEvent> events = new ArrayList<>();
        for (Leg leg : hierarchy.legs()) {
            ReferenceFrame frame = leg.frame();
            double adverse = leg.getDirection().adverseExtreme(bar);
            double originBreach = frame.beyondAnchor0(adverse);

            if (leg.getStatus() == LegStatus.ACTIVE) {
                if (originBreach > 0 && leg.markOriginBreachedAt(bar.getIndex())) {
                    events.add(breachEvent(StructureEventType.ORIGIN_BREACHED, leg, bar, adverse, originBreach));
                }

                ToleranceTier tier = tiers.get(leg);
                if (!tolerance.isOriginBreached(leg, bar, tier)) {
                    continue;
                }
                leg.recordOriginBreach(originBreach);
                Swing swing = hierarchy.swing(leg.getId());
                if (swing != null) {
                    swing.mirrorStatus(SwingStatus.INVALIDATED);
                }

                StructureEvent event = StructureEvent.of(StructureEventType.LEG_INVALIDATED, leg,
                        bar.getIndex(), bar.getTimestamp());
                event.setPrice(adverse);
                event.setDetail(tier.name());
                events.add(event);

                log.debug("Leg {} invalidated at bar {} | tier={} close={} breach={}",
                        leg.getId(), bar.getIndex(), tier, bar.getClose(), leg.getMaxOriginBreach());
            } else if (leg.getStatus() == LegStatus.INVALIDATED) {
                if (originBreach > 0) {
                    leg.recordOriginBreach(originBreach);
                }
                if (!leg.isFormed()) {
                    continue;
                }
                double favorable = leg.getDirection().favorableExtreme(bar);
                double pivotBreach = frame.beyondAnchor1(favorable);
                if (pivotBreach > 0 && leg.recordPivotBreach(pivotBreach)) {
                    events.add(breachEvent(StructureEventType.PIVOT_BREACHED, leg, bar, favorable, pivotBreach));
                    log.debug("Leg {} pivot {} breached at bar {} by {}",
                            leg.getId(), leg.getPivotPrice(), bar.getIndex(), pivotBreach);
                }
            }
        }
        return events;
    }

    private static StructureEvent breachEvent(StructureEventType type, Leg leg, Bar bar, double price, double amount) {
        StructureEvent event = StructureEvent.of(type, leg, bar.getIndex(), bar.getTimestamp());
        event.setPrice(price);
        event.setBreachAmount(amount);
        return event;
    }
}
