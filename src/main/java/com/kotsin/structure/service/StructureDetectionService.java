package com.kotsin.structure.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.structure.config.StructureProperties;
import com.kotsin.structure.detector.Calibration;
import com.kotsin.structure.detector.CalibrationResult;
import com.kotsin.structure.detector.LegDetector;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.logging.DetectionTraceLogger;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.state.DetectorSnapshot;
import com.kotsin.structure.state.SnapshotCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * StructureDetectionService - one detector per symbol.
 *
 * Detectors are single-threaded; every call that touches one holds its
 * monitor, so bars of a symbol are processed strictly one after another.
 */
@Service
@Slf4j
public class StructureDetectionService {

    private final StructureProperties properties;
    private final DetectionTraceLogger traceLogger;
    private final SnapshotCodec codec;
    private final Map<String, LegDetector> detectors = new ConcurrentHashMap<>();

    public StructureDetectionService(StructureProperties properties,
                                     DetectionTraceLogger traceLogger,
                                     ObjectMapper objectMapper) {
        this.properties = properties;
        this.traceLogger = traceLogger;
        this.codec = new SnapshotCodec(objectMapper);
    }

    public CalibrationResult calibrate(String symbol, List<Bar> bars) {
        LegDetector detector = detectorFor(symbol);
        CalibrationResult result;
        synchronized (detector) {
            result = Calibration.run(detector, bars);
        }
        traceLogger.logCalibration(symbol, result);
        return result;
    }

    public List<StructureEvent> processBar(String symbol, Bar bar) {
        LegDetector detector = detectorFor(symbol);
        synchronized (detector) {
            traceLogger.logBarReceived(symbol, bar);
            List<StructureEvent> events = detector.processBar(bar);
            traceLogger.logBarProcessed(symbol, bar.withIndex(detector.getLastBarIndex()),
                    events, detector.getLegs().size(), detector.getSwings().size());
            return events;
        }
    }

    public Optional<DetectorSnapshot> snapshot(String symbol) {
        LegDetector detector = detectors.get(symbol);
        if (detector == null) {
            return Optional.empty();
        }
        synchronized (detector) {
            return Optional.of(detector.snapshot());
        }
    }

    public Optional<String> snapshotJson(String symbol) {
        return snapshot(symbol).map(codec::toJson);
    }

    /**
     * Replaces the symbol's detector with one rebuilt from the snapshot,
     * using the currently bound detection configuration.
     */
    public void restore(String symbol, DetectorSnapshot snapshot) {
        LegDetector restored = LegDetector.restore(snapshot, properties.getDetection());
        detectors.put(symbol, restored);
        log.info("Restored detector for {} at bar {}", symbol, restored.getLastBarIndex());
    }

    public void restoreJson(String symbol, String json) {
        restore(symbol, codec.fromJson(json));
    }

    public boolean reset(String symbol) {
        boolean existed = detectors.remove(symbol) != null;
        if (existed) {
            log.info("Reset detector for {}", symbol);
        }
        return existed;
    }

    public List<Leg> activeLegs(String symbol) {
        LegDetector detector = detectors.get(symbol);
        if (detector == null) {
            return Collections.emptyList();
        }
        synchronized (detector) {
            return detector.getActiveLegs();
        }
    }

    public List<Swing> swings(String symbol) {
        LegDetector detector = detectors.get(symbol);
        if (detector == null) {
            return Collections.emptyList();
        }
        synchronized (detector) {
            return new ArrayList<>(detector.getSwings());
        }
    }

    public Set<String> symbols() {
        return new TreeSet<>(detectors.keySet());
    }

    private LegDetector detectorFor(String symbol) {
        return detectors.computeIfAbsent(symbol, s -> {
            log.info("Creating detector for {}", s);
            return new LegDetector(properties.getDetection());
        });
    }
}
