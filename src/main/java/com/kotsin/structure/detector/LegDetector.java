package com.kotsin.structure.detector;

import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.config.DirectionConfig;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.event.StructureEventType;
import com.kotsin.structure.exception.BarOrderingException;
import com.kotsin.structure.exception.InvalidBarException;
import com.kotsin.structure.exception.StructureDetectionException;
import com.kotsin.structure.exception.StructureDetectionException.ErrorCode;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.hierarchy.InvariantChecker;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegCandidate;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingPoint;
import com.kotsin.structure.pruner.LegPruner;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.state.DetectorSnapshot;
import com.kotsin.structure.state.LegSnapshot;
import com.kotsin.structure.stats.ScaleStatistics;
import com.kotsin.structure.swing.SwingFormer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * LegDetector - incremental leg and swing detection, one bar at a time.
 *
 * Per bar, in order:
 * 0. Ingestion     - reject malformed or out-of-order bars, assign the index
 *    Level crosses - ACTIVE swings from earlier bars against this close
 * 1. Extension     - ACTIVE legs move their pivot to new favorable extremes
 * 2. Pairing       - confirmed swing points pair into candidate legs
 * 3. Breach        - first breaches, graduated origin tolerance, breach maxima
 * 4. Formation     - retracement from the pivot reaches the threshold
 * 5. Pruning       - {@link LegPruner} rules, turn limit keyed on legs formed at step 4
 *
 * Calibration over history and live replay both call {@link #processBar};
 * there is no second code path. Not thread-safe.
 */
@Slf4j
public class LegDetector {

    private static final double FORMATION_EPSILON = 1e-9;

    private final DetectionConfig config;
    private final LegHierarchy hierarchy;
    private final ScaleStatistics statistics;
    private final BarWindow window;
    private final PointConfirmer confirmer;
    private final ToleranceCalculator tolerance;
    private final BreachTracker breachTracker;
    private final LevelCrossTracker levelCrossTracker;
    private final LegPruner pruner;
    private final InvariantChecker invariantChecker;

    private int lastBarIndex = -1;
    private Long lastTimestamp;

    public LegDetector(DetectionConfig config) {
        this(config, new LegHierarchy());
    }

    private LegDetector(DetectionConfig config, LegHierarchy hierarchy) {
        config.validate();
        this.config = config.copy();
        this.hierarchy = hierarchy;
        this.statistics = new ScaleStatistics();
        this.window = new BarWindow(this.config.barWindowSize());
        this.confirmer = new PointConfirmer(this.config.getLookback(), this.config.getMaxPairDistance());
        this.tolerance = new ToleranceCalculator(this.config, hierarchy, statistics);
        this.breachTracker = new BreachTracker(hierarchy, tolerance);
        this.levelCrossTracker = new LevelCrossTracker(hierarchy);
        this.pruner = new LegPruner();
        this.invariantChecker = new InvariantChecker(this.config);
    }

    /**
     * Processes the next bar.
     *
     * @param input bar with timestamp and prices; its index is ignored and reassigned
     * @return events in processing-step order, ascending leg id within a step
     * @throws InvalidBarException   for a null or malformed bar
     * @throws BarOrderingException  when the timestamp does not advance
     */
    public List<StructureEvent> processBar(Bar input) {
        validateBar(input);
        Bar bar = input.withIndex(lastBarIndex + 1);
        Bar previous = window.latest();
        window.add(bar);

        List<StructureEvent> events = new ArrayList<>();

        // 0. Level crosses
        events.addAll(levelCrossTracker.track(bar));

        // 1. Extension
        events.addAll(extendLegs(bar, previous));

        // 2. Confirmation and pairing
        for (SwingPoint point : confirmer.confirm(window, bar.getIndex())) {
            Leg leg = pair(point, bar);
            if (leg != null) {
                StructureEvent event = StructureEvent.of(StructureEventType.LEG_CREATED, leg,
                        bar.getIndex(), bar.getTimestamp());
                event.setPrice(leg.getPivotPrice());
                event.setDetail(String.format("origin=%s@%d pivot=%s@%d",
                        leg.getOriginPrice(), leg.getOriginIndex(), leg.getPivotPrice(), leg.getPivotIndex()));
                events.add(event);
            }
        }

        // 3. Breach tracking
        events.addAll(breachTracker.track(bar));

        // 4. Formation
        List<Leg> formed = new ArrayList<>();
        events.addAll(formLegs(bar, formed));
        refreshImpulsiveness();

        // 5. Pruning
        PruneContext context = PruneContext.builder()
                .bar(bar)
                .hierarchy(hierarchy)
                .config(config)
                .formedThisBar(Collections.unmodifiableList(formed))
                .build();
        events.addAll(pruner.prune(context, statistics));

        if (config.isInvariantChecks()) {
            invariantChecker.verify(hierarchy, bar.getIndex());
        }

        lastBarIndex = bar.getIndex();
        lastTimestamp = bar.getTimestamp();

        if (!events.isEmpty()) {
            log.debug("Bar {} -> {} events, {} legs, {} swings",
                    bar.getIndex(), events.size(), hierarchy.size(), hierarchy.swings().size());
        }
        return events;
    }

    // ========== Ingestion ==========

    private void validateBar(Bar bar) {
        if (bar == null) {
            throw new InvalidBarException("Bar is null");
        }
        double o = bar.getOpen();
        double h = bar.getHigh();
        double l = bar.getLow();
        double c = bar.getClose();
        if (!Double.isFinite(o) || !Double.isFinite(h) || !Double.isFinite(l) || !Double.isFinite(c)) {
            throw new InvalidBarException("Non-finite price in bar at " + bar.getTimestamp() + ": " + bar);
        }
        if (l > Math.min(o, c) || h < Math.max(o, c)) {
            throw new InvalidBarException("Inconsistent OHLC in bar at " + bar.getTimestamp()
                    + ": open=" + o + " high=" + h + " low=" + l + " close=" + c);
        }
        if (lastTimestamp != null && bar.getTimestamp() <= lastTimestamp) {
            throw new BarOrderingException(lastTimestamp, bar.getTimestamp());
        }
    }

    // ========== Extension ==========

    private List<StructureEvent> extendLegs(Bar bar, Bar previous) {
        List<StructureEvent> events = new ArrayList<>();
        for (Leg leg : hierarchy.legs()) {
            if (!leg.isActive()) {
                continue;
            }
            if (previous != null) {
                leg.recordContribution(contribution(leg.getDirection(), bar, previous));
            }

            double favorable = leg.getDirection().favorableExtreme(bar);
            if (leg.frame().ratio(favorable) > 1.0) {
                double previousRange = leg.getRange();
                leg.extendPivot(favorable, bar.getIndex());
                statistics.onRangeChanged(leg, previousRange);

                StructureEvent event = StructureEvent.of(StructureEventType.LEG_EXTENDED, leg,
                        bar.getIndex(), bar.getTimestamp());
                event.setPrice(favorable);
                events.add(event);
            }
        }
        return events;
    }

    /**
     * Bull: how far the close advanced past the previous high.
     * Bear: how far the close dropped below the previous low.
     */
    static double contribution(Direction direction, Bar bar, Bar previous) {
        return direction == Direction.BULL
                ? bar.getClose() - previous.getHigh()
                : previous.getLow() - bar.getClose();
    }

    // ========== Pairing ==========

    private Leg pair(SwingPoint point, Bar bar) {
        SwingPoint opposite = confirmer.mostRecentOpposite(point);
        if (opposite == null) {
            return null;
        }
        // A confirmed high closes an upward move from the last low, and vice versa
        LegCandidate candidate = new LegCandidate(
                point.isHigh() ? Direction.BULL : Direction.BEAR,
                opposite.getPrice(), opposite.getBarIndex(),
                point.getPrice(), point.getBarIndex());
        if (!candidate.isWellFormed()) {
            return null;
        }

        String rejection = checkProtection(candidate, bar);
        if (rejection != null) {
            log.debug("Candidate {} rejected: {}", candidate, rejection);
            return null;
        }

        Leg dominator = pruner.getDominationRule().findDominator(candidate, hierarchy);
        if (dominator != null) {
            log.debug("Candidate {} dominated by leg {}", candidate, dominator.getId());
            return null;
        }

        DirectionConfig dc = config.forDirection(candidate.direction());
        Leg twin = findSelfSeparationConflict(candidate, dc.getSelfSeparation());
        if (twin != null) {
            log.debug("Candidate {} too close to leg {} sharing its pivot", candidate, twin.getId());
            return null;
        }

        Leg parent = findParent(candidate);
        if (parent != null) {
            double separation = Math.abs(candidate.originPrice() - parent.getOriginPrice());
            if (separation < dc.getParentChildSeparation() * parent.getRange()) {
                log.debug("Candidate {} origin {} from parent {}, below {}", candidate, separation,
                        parent.getId(), dc.getParentChildSeparation() * parent.getRange());
                return null;
            }
        }

        return createLeg(candidate, parent, bar);
    }

    /**
     * No bar after the origin, up to the current one, may have traded past
     * the origin or past the pivot. No tolerance.
     */
    private String checkProtection(LegCandidate candidate, Bar bar) {
        ReferenceFrame frame = candidate.frame();
        Direction direction = candidate.direction();
        for (int i = candidate.originIndex() + 1; i <= bar.getIndex(); i++) {
            Bar b = window.get(i);
            if (frame.ratio(direction.adverseExtreme(b)) < 0) {
                return "origin violated at bar " + i;
            }
            if (frame.ratio(direction.favorableExtreme(b)) > 1) {
                return "pivot exceeded at bar " + i;
            }
        }
        return null;
    }

    private Leg findSelfSeparationConflict(LegCandidate candidate, double selfSeparation) {
        double minDistance = selfSeparation * candidate.range();
        for (Leg leg : hierarchy.liveLegs(candidate.direction())) {
            if (leg.isActive()
                    && leg.getPivotIndex() == candidate.pivotIndex()
                    && leg.getPivotPrice() == candidate.pivotPrice()
                    && Math.abs(leg.getOriginPrice() - candidate.originPrice()) < minDistance) {
                return leg;
            }
        }
        return null;
    }

    /**
     * Tightest ACTIVE same-direction leg that started earlier and spans the
     * candidate: origin at or beyond the candidate's origin, pivot at or
     * beyond its pivot. Ties: smaller range, later origin, lower id.
     */
    private Leg findParent(LegCandidate candidate) {
        ReferenceFrame frame = candidate.frame();
        Leg best = null;
        for (Leg leg : hierarchy.liveLegs(candidate.direction())) {
            if (!leg.isActive() || leg.getOriginIndex() >= candidate.originIndex()) {
                continue;
            }
            if (frame.ratio(leg.getOriginPrice()) > 0 || frame.ratio(leg.getPivotPrice()) < 1) {
                continue;
            }
            if (best == null
                    || leg.getRange() < best.getRange()
                    || (leg.getRange() == best.getRange() && leg.getOriginIndex() > best.getOriginIndex())) {
                best = leg;
            }
        }
        return best;
    }

    private Leg createLeg(LegCandidate candidate, Leg parent, Bar bar) {
        Leg leg = Leg.builder()
                .id(hierarchy.allocateId())
                .direction(candidate.direction())
                .originPrice(candidate.originPrice())
                .originIndex(candidate.originIndex())
                .pivotPrice(candidate.pivotPrice())
                .pivotIndex(candidate.pivotIndex())
                .createdAtBar(bar.getIndex())
                .build();

        double counterRange = 0.0;
        for (Leg counter : hierarchy.liveLegs(candidate.direction().opposite())) {
            if (counter.getPivotIndex() == candidate.originIndex()
                    && counter.getPivotPrice() == candidate.originPrice()) {
                counterRange = Math.max(counterRange, counter.getRange());
            }
        }
        leg.setOriginCounterTrendRange(counterRange);

        // Seed impulse moments with the bars already behind the leg
        for (int i = candidate.originIndex() + 1; i <= bar.getIndex(); i++) {
            leg.recordContribution(contribution(leg.getDirection(), window.get(i), window.get(i - 1)));
        }

        hierarchy.add(leg, parent == null ? null : parent.getId());
        statistics.onLegCreated(leg);

        log.debug("Leg {} created at bar {} | {} origin={}@{} pivot={}@{} parent={}",
                leg.getId(), bar.getIndex(), leg.getDirection(), leg.getOriginPrice(), leg.getOriginIndex(),
                leg.getPivotPrice(), leg.getPivotIndex(), leg.getParentId());
        return leg;
    }

    // ========== Formation ==========

    private List<StructureEvent> formLegs(Bar bar, List<Leg> formed) {
        List<StructureEvent> events = new ArrayList<>();
        for (Leg leg : hierarchy.legs()) {
            if (!leg.isActive() || leg.isFormed()) {
                continue;
            }
            double threshold = config.forDirection(leg.getDirection()).getFormationThreshold();
            double retracement = leg.frame().retracement(bar.getClose());
            if (retracement + FORMATION_EPSILON < threshold) {
                continue;
            }

            leg.markFormed(bar.getIndex());
            statistics.onLegFormed(leg);
            Swing swing = SwingFormer.form(leg, bar.getTimestamp());
            hierarchy.putSwing(swing);
            levelCrossTracker.onSwingFormed(swing, bar.getClose());
            formed.add(leg);

            StructureEvent event = StructureEvent.of(StructureEventType.SWING_FORMED, leg,
                    bar.getIndex(), bar.getTimestamp());
            event.setPrice(bar.getClose());
            event.setDetail(String.format("retracement=%.4f", retracement));
            events.add(event);
        }
        return events;
    }

    private void refreshImpulsiveness() {
        for (Leg leg : hierarchy.legs()) {
            if (leg.isActive()) {
                leg.setImpulsiveness(statistics.impulsiveness(leg.getImpulse()));
            }
        }
    }

    // ========== Snapshot ==========

    public DetectorSnapshot snapshot() {
        List<LegSnapshot> legs = new ArrayList<>();
        for (Leg leg : hierarchy.legs()) {
            legs.add(LegSnapshot.from(leg));
        }
        List<Swing> swings = new ArrayList<>();
        for (Swing swing : hierarchy.swings()) {
            swings.add(swing.toBuilder().build());
        }
        return DetectorSnapshot.builder()
                .formatVersion(DetectorSnapshot.FORMAT_VERSION)
                .lastBarIndex(lastBarIndex)
                .lastTimestamp(lastTimestamp)
                .nextLegId(hierarchy.getNextLegId())
                .legs(legs)
                .swings(swings)
                .barWindow(window.toList())
                .confirmedHighs(confirmer.getHighs())
                .confirmedLows(confirmer.getLows())
                .formedImpulses(statistics.formedImpulses())
                .levelBands(levelCrossTracker.getBands())
                .build();
    }

    /**
     * Rebuilds a detector from a snapshot. The next {@link #processBar} call
     * continues exactly where the snapshotted detector stopped.
     *
     * @throws StructureDetectionException with INVALID_SNAPSHOT when the
     *         snapshot is inconsistent
     */
    public static LegDetector restore(DetectorSnapshot snapshot, DetectionConfig config) {
        if (snapshot == null) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT, "Snapshot is null");
        }
        LegDetector detector = new LegDetector(config, new LegHierarchy(snapshot.getNextLegId()));

        List<Leg> legs = new ArrayList<>();
        for (LegSnapshot ls : nullToEmpty(snapshot.getLegs())) {
            Leg leg = ls.toLeg();
            legs.add(leg);
            detector.hierarchy.restore(leg);
        }
        for (Swing swing : nullToEmpty(snapshot.getSwings())) {
            detector.hierarchy.putSwing(swing.toBuilder().build());
        }
        for (Bar bar : nullToEmpty(snapshot.getBarWindow())) {
            detector.window.add(bar);
        }
        if (snapshot.getLevelBands() != null) {
            detector.levelCrossTracker.restore(snapshot.getLevelBands());
        }
        detector.confirmer.restore(nullToEmpty(snapshot.getConfirmedHighs()), nullToEmpty(snapshot.getConfirmedLows()));
        detector.statistics.restore(nullToEmpty(snapshot.getFormedImpulses()), legs);
        detector.lastBarIndex = snapshot.getLastBarIndex();
        detector.lastTimestamp = snapshot.getLastTimestamp();

        if (detector.window.size() > 0 && detector.window.lastIndex() != detector.lastBarIndex) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT, "Bar window ends at "
                    + detector.window.lastIndex() + " but last bar is " + detector.lastBarIndex);
        }
        try {
            detector.invariantChecker.verify(detector.hierarchy, detector.lastBarIndex);
        } catch (StructureDetectionException e) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT,
                    "Snapshot violates structure invariants: " + e.getMessage(), e);
        }

        log.info("Detector restored at bar {} with {} legs, {} swings, {} formed",
                detector.lastBarIndex, detector.hierarchy.size(), detector.hierarchy.swings().size(),
                detector.statistics.formedCount());
        return detector;
    }

    private static <T> Collection<T> nullToEmpty(Collection<T> values) {
        return values == null ? Collections.emptyList() : values;
    }

    // ========== Accessors ==========

    public List<Leg> getActiveLegs() {
        return hierarchy.activeLegs();
    }

    public Collection<Leg> getLegs() {
        return hierarchy.legs();
    }

    public Leg getLeg(long id) {
        return hierarchy.get(id);
    }

    public Collection<Swing> getSwings() {
        return hierarchy.swings();
    }

    public LegHierarchy getHierarchy() {
        return hierarchy;
    }

    public ScaleStatistics getStatistics() {
        return statistics;
    }

    public DetectionConfig getConfig() {
        return config;
    }

    public int getLastBarIndex() {
        return lastBarIndex;
    }

    public Long getLastTimestamp() {
        return lastTimestamp;
    }
}
