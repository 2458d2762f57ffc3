package com.kotsin.structure.detector;

import com.kotsin.structure.BarFixtures;
import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.event.StructureEventType;
import com.kotsin.structure.exception.BarOrderingException;
import com.kotsin.structure.exception.InvalidBarException;
import com.kotsin.structure.exception.InvalidConfigurationException;
import com.kotsin.structure.exception.StructureDetectionException;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.kotsin.structure.BarFixtures.bar;
import static org.junit.jupiter.api.Assertions.*;

class LegDetectorTest {

    private DetectionConfig config;

    @BeforeEach
    void setUp() {
        config = DetectionConfig.defaults();
    }

    private static List<List<StructureEvent>> run(LegDetector detector, List<Bar> bars) {
        List<List<StructureEvent>> perBar = new ArrayList<>();
        for (Bar bar : bars) {
            perBar.add(detector.processBar(bar));
        }
        return perBar;
    }

    private static List<StructureEventType> types(List<StructureEvent> events) {
        return events.stream().map(StructureEvent::getType).toList();
    }

    /**
     * Reflects bars around 4525 so highs become lows.
     */
    private static List<Bar> mirrored(List<Bar> bars) {
        List<Bar> out = new ArrayList<>();
        for (Bar b : bars) {
            out.add(Bar.of(b.getTimestamp(), 9050 - b.getOpen(), 9050 - b.getLow(), 9050 - b.getHigh(), 9050 - b.getClose()));
        }
        return out;
    }

    // ========== Ingestion ==========

    @Test
    @DisplayName("Empty and single-bar histories produce no structure")
    void testProcessBar_SingleBar() {
        LegDetector detector = new LegDetector(config);
        assertEquals(-1, detector.getLastBarIndex());
        assertTrue(detector.getLegs().isEmpty());

        assertTrue(detector.processBar(bar(0, 100, 101, 99, 100)).isEmpty());
        assertEquals(0, detector.getLastBarIndex());
        assertTrue(detector.getLegs().isEmpty());
        assertTrue(detector.getSwings().isEmpty());
    }

    @Test
    @DisplayName("Non-increasing timestamps are rejected without changing state")
    void testProcessBar_OutOfOrder() {
        LegDetector detector = new LegDetector(config);
        detector.processBar(bar(5, 100, 101, 99, 100));

        BarOrderingException equal = assertThrows(BarOrderingException.class,
                () -> detector.processBar(bar(5, 100, 101, 99, 100)));
        assertEquals(StructureDetectionException.ErrorCode.BAR_OUT_OF_ORDER, equal.getErrorCode());
        assertThrows(BarOrderingException.class, () -> detector.processBar(bar(4, 100, 101, 99, 100)));

        assertEquals(0, detector.getLastBarIndex());
        assertTrue(detector.processBar(bar(6, 100, 101, 99, 100)).isEmpty());
        assertEquals(1, detector.getLastBarIndex());
    }

    @Test
    @DisplayName("Malformed bars are rejected")
    void testProcessBar_Malformed() {
        LegDetector detector = new LegDetector(config);

        assertThrows(InvalidBarException.class, () -> detector.processBar(null));
        assertThrows(InvalidBarException.class, () -> detector.processBar(bar(0, 100, 99, 98, 100)));
        assertThrows(InvalidBarException.class, () -> detector.processBar(bar(0, 100, 101, 100.5, 100)));
        assertThrows(InvalidBarException.class, () -> detector.processBar(bar(0, Double.NaN, 101, 99, 100)));
        InvalidBarException ex = assertThrows(InvalidBarException.class,
                () -> detector.processBar(bar(0, 100, Double.POSITIVE_INFINITY, 99, 100)));
        assertTrue(ex.isInputError());
        assertEquals(-1, detector.getLastBarIndex());
    }

    @Test
    @DisplayName("Invalid configuration is refused at construction")
    void testConstruct_InvalidConfig() {
        config.setLookback(0);
        assertThrows(InvalidConfigurationException.class, () -> new LegDetector(config));
    }

    @Test
    @DisplayName("Detector keeps its own copy of the configuration")
    void testConstruct_ConfigCopied() {
        LegDetector detector = new LegDetector(config);
        config.getBull().setFormationThreshold(0.9);

        assertEquals(0.382, detector.getConfig().getBull().getFormationThreshold(), 1e-9);
    }

    // ========== Creation ==========

    @Test
    @DisplayName("Bull leg is created when the pivot high confirms")
    void testCreation_BullLeg() {
        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, BarFixtures.bullLegSetup());

        for (int i = 0; i < 7; i++) {
            assertTrue(perBar.get(i).isEmpty(), "bar " + i);
        }
        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(7)));
        StructureEvent created = perBar.get(7).get(0);
        assertEquals(1L, created.getLegId());
        assertEquals(Direction.BULL, created.getDirection());
        assertEquals(7, created.getBarIndex());
        assertEquals(4530.0, created.getPrice(), 1e-9);
        assertNull(created.getParentId());

        Leg leg = detector.getLeg(1L);
        assertEquals(4520.0, leg.getOriginPrice(), 1e-9);
        assertEquals(2, leg.getOriginIndex());
        assertEquals(4530.0, leg.getPivotPrice(), 1e-9);
        assertEquals(5, leg.getPivotIndex());
        assertEquals(7, leg.getCreatedAtBar());
        assertEquals(LegStatus.ACTIVE, leg.getStatus());
        assertFalse(leg.isFormed());
        assertEquals(5, leg.getBarCount());
        assertEquals(10.0 / 3.0, leg.getImpulse(), 1e-9);
    }

    @Test
    @DisplayName("Mirrored bars create the mirrored bear leg")
    void testCreation_BearLeg() {
        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, mirrored(BarFixtures.bullLegSetup()));

        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(7)));
        Leg leg = detector.getLeg(1L);
        assertEquals(Direction.BEAR, leg.getDirection());
        assertEquals(4530.0, leg.getOriginPrice(), 1e-9);
        assertEquals(4520.0, leg.getPivotPrice(), 1e-9);
        assertEquals(10.0, leg.getRange(), 1e-9);
    }

    // ========== Lifecycle ==========

    @Test
    @DisplayName("Extension, then invalidation with frozen pivot; unformed leg is never engulfed")
    void testLifecycle_ExtendInvalidateFreeze() {
        List<Bar> bars = new ArrayList<>(BarFixtures.bullLegSetup());
        bars.add(bar(8, 4529, 4535, 4529, 4534));
        bars.add(bar(9, 4534, 4534, 4518, 4519));
        bars.add(bar(10, 4519, 4540, 4519, 4538));

        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, bars);
        Leg leg = detector.getLeg(1L);

        assertEquals(List.of(StructureEventType.LEG_EXTENDED), types(perBar.get(8)));
        assertEquals(4535.0, perBar.get(8).get(0).getPrice(), 1e-9);

        assertEquals(List.of(StructureEventType.ORIGIN_BREACHED, StructureEventType.LEG_INVALIDATED),
                types(perBar.get(9)));
        StructureEvent breached = perBar.get(9).get(0);
        assertEquals(4518.0, breached.getPrice(), 1e-9);
        assertEquals(2.0, breached.getBreachAmount(), 1e-9);
        StructureEvent invalidated = perBar.get(9).get(1);
        assertEquals(4518.0, invalidated.getPrice(), 1e-9);
        assertEquals("UNFORMED", invalidated.getDetail());

        assertTrue(perBar.get(10).isEmpty());
        assertNotNull(leg);
        assertEquals(LegStatus.INVALIDATED, leg.getStatus());
        assertFalse(leg.isFormed());
        assertEquals(4535.0, leg.getPivotPrice(), 1e-9);
        assertEquals(8, leg.getPivotIndex());
        assertEquals(2.0, leg.getMaxOriginBreach(), 1e-9);
        assertNull(leg.getMaxPivotBreach());
        assertEquals(9, leg.getOriginBreachedAtBar());
        assertTrue(detector.getActiveLegs().isEmpty());
    }

    // ========== Formation ==========

    private static List<Bar> formationBars() {
        List<Bar> bars = new ArrayList<>(BarFixtures.bullLegSetup().subList(0, 5));
        bars.add(bar(5, 4527, 4536, 4526, 4535));
        bars.add(bar(6, 4535, 4535, 4531, 4533));
        bars.add(bar(7, 4533, 4534, 4531, 4532));
        bars.add(bar(8, 4532, 4533, 4530, 4530));
        bars.add(bar(9, 4530, 4531, 4528, 4529));
        bars.add(bar(10, 4529, 4530, 4527, 4530));
        return bars;
    }

    @Test
    @DisplayName("Leg forms once, exactly at the threshold retracement")
    void testFormation_AtThreshold() {
        config.getBull().setFormationThreshold(0.375);
        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, formationBars());

        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(7)));
        assertEquals(List.of(StructureEventType.SWING_FORMED), types(perBar.get(8)));
        assertEquals(4530.0, perBar.get(8).get(0).getPrice(), 1e-9);
        assertEquals(List.of(StructureEventType.LEVEL_CROSS), types(perBar.get(9)));
        assertEquals(List.of(StructureEventType.LEVEL_CROSS), types(perBar.get(10)));

        Leg leg = detector.getLeg(1L);
        assertTrue(leg.isFormed());
        assertEquals(8, leg.getFormedAtBar());
        assertEquals(LegStatus.ACTIVE, leg.getStatus());
        assertEquals(0.0, leg.getImpulsiveness(), 1e-9);

        assertEquals(1, detector.getSwings().size());
        Swing swing = detector.getSwings().iterator().next();
        assertEquals(1L, swing.getLegId());
        assertEquals(SwingStatus.ACTIVE, swing.getStatus());
        assertEquals(BarFixtures.T0 + 8 * BarFixtures.MINUTE, swing.getFormedAtTimestamp());
        assertEquals(4528.0, swing.levelPrice(0.5), 1e-9);
        assertEquals(4536.0, swing.levelPrice(1.0), 1e-9);
        assertEquals(4552.0, swing.levelPrice(2.0), 1e-9);
    }

    @Test
    @DisplayName("Below the threshold nothing forms")
    void testFormation_BelowThreshold() {
        config.getBull().setFormationThreshold(0.45);
        LegDetector detector = new LegDetector(config);
        run(detector, formationBars());

        assertFalse(detector.getLeg(1L).isFormed());
        assertTrue(detector.getSwings().isEmpty());
    }

    // ========== Level crosses ==========

    @Test
    @DisplayName("Close moving into another Fibonacci band of an active swing emits a level cross")
    void testLevelCross_BandChanges() {
        config.getBull().setFormationThreshold(0.375);
        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, formationBars());

        // Swing 4520 -> 4536 formed on close 4530 (ratio 0.625, band 0.618)
        StructureEvent down = perBar.get(9).get(0);
        assertEquals(1L, down.getLegId());
        assertEquals(4529.0, down.getPrice(), 1e-9);
        assertEquals(0.5, down.getLevel(), 1e-9);
        assertEquals(0.618, down.getPreviousLevel(), 1e-9);
        assertEquals("DOWN", down.getDetail());

        StructureEvent up = perBar.get(10).get(0);
        assertEquals(0.618, up.getLevel(), 1e-9);
        assertEquals(0.5, up.getPreviousLevel(), 1e-9);
        assertEquals("UP", up.getDetail());

        assertEquals(0.618, detector.snapshot().getLevelBands().get(1L), 1e-9);

        // Same band again: nothing
        assertTrue(detector.processBar(bar(11, 4530, 4531, 4529, 4530.5)).isEmpty());
    }

    // ========== Engulfment ==========

    @Test
    @DisplayName("Formed leg breached at the origin and then past its pivot is engulfed")
    void testEngulfment_FormedLeg() {
        config.getBull().setFormationThreshold(0.375);
        List<Bar> bars = formationBars();
        bars.add(bar(11, 4530, 4530, 4510, 4512));
        bars.add(bar(12, 4512, 4540, 4512, 4539));

        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, bars.subList(0, 12));
        Leg leg = detector.getLeg(1L);

        assertEquals(List.of(StructureEventType.LEVEL_CROSS, StructureEventType.ORIGIN_BREACHED,
                StructureEventType.LEG_INVALIDATED), types(perBar.get(11)));
        assertEquals(0.0, perBar.get(11).get(0).getLevel(), 1e-9);
        assertEquals(10.0, perBar.get(11).get(1).getBreachAmount(), 1e-9);
        assertEquals("BIG", perBar.get(11).get(2).getDetail());
        assertEquals(SwingStatus.INVALIDATED, detector.getSwings().iterator().next().getStatus());

        List<StructureEvent> last = detector.processBar(bars.get(12));
        assertEquals(List.of(StructureEventType.PIVOT_BREACHED, StructureEventType.LEG_PRUNED), types(last));
        assertEquals(4540.0, last.get(0).getPrice(), 1e-9);
        assertEquals(4.0, last.get(0).getBreachAmount(), 1e-9);
        assertEquals(PruneReason.ENGULFED, last.get(1).getReason());

        assertEquals(LegStatus.PRUNED, leg.getStatus());
        assertEquals(4536.0, leg.getPivotPrice(), 1e-9);
        assertEquals(10.0, leg.getMaxOriginBreach(), 1e-9);
        assertEquals(4.0, leg.getMaxPivotBreach(), 1e-9);
        assertNull(detector.getLeg(1L));
        assertTrue(detector.getSwings().isEmpty());
    }

    // ========== Turn limit ==========

    /**
     * Bear leg 1 (140 -> 100, extended to 90) and its child bear leg 3
     * (110 -> 90) end at the 90 low of bar 13. Bull leg 2 (100 -> 110) sits
     * at leg 3's origin, so leg 3 outranks leg 1. Bull leg 4 (90 -> 96) is
     * created at bar 18 and forms at bar 19.
     */
    private static List<Bar> turnBars() {
        List<Bar> bars = new ArrayList<>();
        bars.add(bar(0, 130, 131, 128, 129));
        bars.add(bar(1, 129, 133, 128, 132));
        bars.add(bar(2, 132, 140, 131, 138));
        bars.add(bar(3, 138, 139, 120, 121));
        bars.add(bar(4, 121, 122, 110, 111));
        bars.add(bar(5, 111, 112, 104, 105));
        bars.add(bar(6, 105, 106, 100, 103));
        bars.add(bar(7, 103, 105, 101, 104));
        bars.add(bar(8, 104, 107, 102, 106));
        bars.add(bar(9, 106, 110, 105, 108));
        bars.add(bar(10, 108, 109, 106, 107));
        bars.add(bar(11, 107, 108, 106, 107));
        bars.add(bar(12, 107, 107, 95, 96));
        bars.add(bar(13, 96, 97, 90, 92));
        bars.add(bar(14, 92, 94, 91, 93));
        bars.add(bar(15, 93, 95, 92, 94));
        bars.add(bar(16, 94, 96, 93, 95));
        bars.add(bar(17, 95, 95.5, 93, 94));
        bars.add(bar(18, 94, 95, 93.5, 94.5));
        bars.add(bar(19, 94.5, 95, 93, 93.5));
        return bars;
    }

    @Test
    @DisplayName("Turn limit runs when the new leg forms, not when it is created")
    void testTurnLimit_AppliedAtFormation() {
        config.getBear().setMaxLegsPerTurn(1);
        List<Bar> bars = turnBars();
        LegDetector detector = new LegDetector(config);
        List<List<StructureEvent>> perBar = run(detector, bars.subList(0, 19));

        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(8)));
        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(11)));
        assertEquals(List.of(StructureEventType.LEG_EXTENDED, StructureEventType.ORIGIN_BREACHED,
                StructureEventType.LEG_INVALIDATED), types(perBar.get(12)));
        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(15)));
        assertEquals(1L, perBar.get(15).get(0).getParentId());

        // Created at bar 18, unformed: both counter legs still there
        assertEquals(List.of(StructureEventType.LEG_CREATED), types(perBar.get(18)));
        Leg bull = detector.getLeg(4L);
        assertEquals(Direction.BULL, bull.getDirection());
        assertEquals(90.0, bull.getOriginPrice(), 1e-9);
        assertEquals(96.0, bull.getPivotPrice(), 1e-9);
        assertFalse(bull.isFormed());
        assertNotNull(detector.getLeg(1L));
        assertNotNull(detector.getLeg(3L));
        assertEquals(0.0, detector.getLeg(1L).getOriginCounterTrendRange(), 1e-9);
        assertEquals(10.0, detector.getLeg(3L).getOriginCounterTrendRange(), 1e-9);

        List<StructureEvent> formation = detector.processBar(bars.get(19));
        assertEquals(List.of(StructureEventType.SWING_FORMED, StructureEventType.LEG_PRUNED), types(formation));
        assertEquals(4L, formation.get(0).getLegId());
        assertEquals(1L, formation.get(1).getLegId());
        assertEquals(PruneReason.TURN_LIMIT, formation.get(1).getReason());

        assertTrue(bull.isFormed());
        assertNull(detector.getLeg(1L));
        Leg survivor = detector.getLeg(3L);
        assertNull(survivor.getParentId());
        assertEquals(6.0, survivor.getTurnSurvivalScale(), 1e-9);
    }

    @Test
    @DisplayName("A leg that never forms never triggers the turn limit")
    void testTurnLimit_UnformedLegNoTurn() {
        config.getBear().setMaxLegsPerTurn(1);
        List<Bar> bars = new ArrayList<>(turnBars().subList(0, 19));
        bars.add(bar(19, 94.5, 95.5, 94, 95));
        bars.add(bar(20, 95, 95.5, 94.5, 95));

        LegDetector detector = new LegDetector(config);
        run(detector, bars);

        assertFalse(detector.getLeg(4L).isFormed());
        assertNotNull(detector.getLeg(1L));
        assertNotNull(detector.getLeg(3L));
        assertEquals(0.0, detector.getLeg(3L).getTurnSurvivalScale(), 1e-9);
    }

    // ========== Contribution ==========

    @Test
    @DisplayName("Per-bar contribution measures the close past the previous extreme")
    void testContribution() {
        Bar previous = bar(0, 100, 105, 95, 102);
        Bar current = bar(1, 102, 110, 94, 108);

        assertEquals(3.0, LegDetector.contribution(Direction.BULL, current, previous), 1e-9);
        assertEquals(-13.0, LegDetector.contribution(Direction.BEAR, current, previous), 1e-9);
    }
}
