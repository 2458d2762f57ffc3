package com.kotsin.structure.logging;

import com.kotsin.structure.detector.CalibrationResult;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.model.Bar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * DetectionTraceLogger - staged trace of the bar flow through the detector.
 *
 * INPUT -> BAR -> EVENT* -> OUTPUT
 *
 * Format: [STAGE] time | symbol | key metrics
 */
@Slf4j
@Component
public class DetectionTraceLogger {

    private static final DateTimeFormatter TIME_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.of("UTC"));

    @Value("${structure.trace.enabled:false}")
    private boolean traceEnabled;

    public void logBarReceived(String symbol, Bar bar) {
        if (!traceEnabled || bar == null) return;
        log.info("┌─[INPUT] {} | {} | OHLC={}/{}/{}/{}",
                formatTime(bar.getTimestamp()), symbol,
                fmt(bar.getOpen()), fmt(bar.getHigh()), fmt(bar.getLow()), fmt(bar.getClose()));
    }

    public void logBarProcessed(String symbol, Bar bar, List<StructureEvent> events, int legCount, int swingCount) {
        if (!traceEnabled) return;
        log.info("├─[BAR] {} | {} | events={} legs={} swings={}",
                formatTime(bar.getTimestamp()), symbol, events.size(), legCount, swingCount);
        for (StructureEvent event : events) {
            logEvent(symbol, event);
        }
    }

    public void logEvent(String symbol, StructureEvent event) {
        if (!traceEnabled) return;
        log.info("├─[{}] bar={} | {} | leg={} {} parent={} children={}{}{}",
                event.getType(), event.getBarIndex(), symbol,
                event.getLegId(), event.getDirection(), event.getParentId(), event.getChildIds(),
                event.getReason() != null ? " reason=" + event.getReason() : "",
                event.getDetail() != null ? " | " + event.getDetail() : "");
    }

    public void logPublished(String symbol, int count, String topic) {
        if (!traceEnabled) return;
        log.info("└─[OUTPUT] {} | {} events -> {}", symbol, count, topic);
    }

    /**
     * Rejected input is always logged, trace or not.
     */
    public void logRejected(String symbol, String reason) {
        log.warn("✗─[REJECTED] {} | {}", symbol, reason);
    }

    public void logCalibration(String symbol, CalibrationResult result) {
        log.info("═─[CALIBRATION] {} | bars={} legs={} active={} swings={} events={} | {}ms",
                symbol, result.getBarCount(), result.getLegCount(), result.getActiveLegCount(),
                result.getSwingCount(), result.getEvents().size(), result.getElapsedMillis());
    }

    private String formatTime(long timestamp) {
        return TIME_FMT.format(Instant.ofEpochMilli(timestamp));
    }

    private String fmt(double value) {
        return String.format("%.2f", value);
    }
}
