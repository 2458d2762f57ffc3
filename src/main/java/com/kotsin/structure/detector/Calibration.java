package com.kotsin.structure.detector;

import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.model.Bar;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch run over history: nothing more than {@link LegDetector#processBar}
 * in a loop, so calibrated state matches bar-by-bar replay exactly.
 */
@Slf4j
public final class Calibration {

    private static final int PROGRESS_INTERVAL = 10_000;

    private Calibration() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static CalibrationResult run(LegDetector detector, List<Bar> bars) {
        long start = System.currentTimeMillis();
        log.info("Calibration started: {} bars, detector at bar {}", bars.size(), detector.getLastBarIndex());

        List<StructureEvent> events = new ArrayList<>();
        int processed = 0;
        for (Bar bar : bars) {
            events.addAll(detector.processBar(bar));
            processed++;
            if (processed % PROGRESS_INTERVAL == 0) {
                log.info("Calibration progress: {}/{} bars, {} legs, {} events",
                        processed, bars.size(), detector.getLegs().size(), events.size());
            }
        }

        CalibrationResult result = CalibrationResult.builder()
                .barCount(processed)
                .events(events)
                .activeLegCount(detector.getActiveLegs().size())
                .legCount(detector.getLegs().size())
                .swingCount(detector.getSwings().size())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();

        log.info("Calibration finished: {} bars in {} ms | legs={} active={} swings={} events={}",
                result.getBarCount(), result.getElapsedMillis(), result.getLegCount(),
                result.getActiveLegCount(), result.getSwingCount(), events.size());
        return result;
    }
}
