package com.kotsin.structure.detector;

import com.kotsin.structure.BarFixtures;
import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.exception.StructureDetectionException;
import com.kotsin.structure.exception.StructureDetectionException.ErrorCode;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.state.DetectorSnapshot;
import com.kotsin.structure.state.SnapshotCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotReplayTest {

    private static final int SPLIT = 1200;

    private final SnapshotCodec codec = new SnapshotCodec();
    private final List<Bar> bars = BarFixtures.randomWalk(2024L, 2500);

    private static List<StructureEvent> process(LegDetector detector, List<Bar> bars) {
        List<StructureEvent> events = new ArrayList<>();
        for (Bar bar : bars) {
            events.addAll(detector.processBar(bar));
        }
        return events;
    }

    @Test
    @DisplayName("Snapshot, JSON round trip and restore continue exactly like an uninterrupted run")
    void testRestore_ContinuesIdentically() {
        DetectionConfig config = DetectionConfig.defaults();

        LegDetector uninterrupted = new LegDetector(config);
        process(uninterrupted, bars.subList(0, SPLIT));
        List<StructureEvent> expected = process(uninterrupted, bars.subList(SPLIT, bars.size()));

        LegDetector first = new LegDetector(config);
        process(first, bars.subList(0, SPLIT));
        String json = codec.toJson(first.snapshot());

        LegDetector resumed = LegDetector.restore(codec.fromJson(json), config);
        assertEquals(SPLIT - 1, resumed.getLastBarIndex());
        assertEquals(first.getLegs().size(), resumed.getLegs().size());

        List<StructureEvent> actual = process(resumed, bars.subList(SPLIT, bars.size()));

        assertFalse(expected.isEmpty());
        assertEquals(expected, actual);
        assertEquals(codec.toJson(uninterrupted.snapshot()), codec.toJson(resumed.snapshot()));
    }

    @Test
    @DisplayName("Fresh detector snapshot restores to a fresh detector")
    void testRestore_Empty() {
        DetectionConfig config = DetectionConfig.defaults();
        DetectorSnapshot snapshot = new LegDetector(config).snapshot();

        LegDetector restored = LegDetector.restore(codec.fromJson(codec.toJson(snapshot)), config);

        assertEquals(-1, restored.getLastBarIndex());
        assertNull(restored.getLastTimestamp());
        assertTrue(restored.getLegs().isEmpty());
        assertEquals(process(new LegDetector(config), bars.subList(0, 300)),
                process(restored, bars.subList(0, 300)));
    }

    @Test
    @DisplayName("Inconsistent snapshots are refused")
    void testRestore_Inconsistent() {
        DetectionConfig config = DetectionConfig.defaults();
        LegDetector detector = new LegDetector(config);
        process(detector, bars.subList(0, 600));

        DetectorSnapshot dangling = detector.snapshot();
        assertFalse(dangling.getLegs().isEmpty());
        dangling.getLegs().get(0).setParentId(999_999L);
        StructureDetectionException ex = assertThrows(StructureDetectionException.class,
                () -> LegDetector.restore(dangling, config));
        assertEquals(ErrorCode.INVALID_SNAPSHOT, ex.getErrorCode());

        DetectorSnapshot shifted = detector.snapshot();
        shifted.setLastBarIndex(shifted.getLastBarIndex() + 5);
        ex = assertThrows(StructureDetectionException.class, () -> LegDetector.restore(shifted, config));
        assertEquals(ErrorCode.INVALID_SNAPSHOT, ex.getErrorCode());

        ex = assertThrows(StructureDetectionException.class, () -> LegDetector.restore(null, config));
        assertEquals(ErrorCode.INVALID_SNAPSHOT, ex.getErrorCode());
    }
}
