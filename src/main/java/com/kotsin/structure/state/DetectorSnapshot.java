package com.kotsin.structure.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Swing;
import com.kotsin.structure.model.SwingPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Detector state at a bar boundary. Configuration is not part of it: the
 * restoring side supplies its own.
 *
 * Replay from a snapshot continues exactly where the run that produced it
 * stopped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectorSnapshot {

    public static final int FORMAT_VERSION = 1;

    private int formatVersion;

    /** -1 before the first bar. */
    private int lastBarIndex;
    private Long lastTimestamp;
    private long nextLegId;

    private List<LegSnapshot> legs;
    private List<Swing> swings;

    /** Bars needed for confirmation, pairing and protection checks. */
    private List<Bar> barWindow;
    private List<SwingPoint> confirmedHighs;
    private List<SwingPoint> confirmedLows;

    /** Frozen formed-population impulses, ascending. */
    private List<Double> formedImpulses;

    /** Last Fibonacci band per swing, keyed by leg id. */
    private Map<Long, Double> levelBands;
}
