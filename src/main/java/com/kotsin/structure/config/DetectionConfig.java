package com.kotsin.structure.config;

import com.kotsin.structure.exception.InvalidConfigurationException;
import com.kotsin.structure.model.Direction;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Detection parameters: per-direction blocks plus the global knobs.
 *
 * Bound from {@code structure.detection.*} by {@link StructureProperties};
 * detectors receive their own copy and never see later edits.
 */
@Data
@NoArgsConstructor
public class DetectionConfig {

    private DirectionConfig bull = new DirectionConfig();

    private DirectionConfig bear = new DirectionConfig();

    /**
     * Bars on each side a swing point must strictly dominate. Confirmation
     * lags the bar by this many bars.
     */
    private int lookback = 2;

    /**
     * Max bar distance between the two confirmed points of a new leg.
     */
    private int maxPairDistance = 200;

    /**
     * An invalidated leg whose origin breach reaches this multiple of its
     * range is stale.
     */
    private double staleExtension = 3.0;

    /**
     * Verify hierarchy, swing and breach invariants after every bar.
     */
    private boolean invariantChecks = true;

    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    public DirectionConfig forDirection(Direction direction) {
        return direction == Direction.BULL ? bull : bear;
    }

    /**
     * Bars retained for confirmation, pairing and protection checks.
     */
    public int barWindowSize() {
        return maxPairDistance + lookback + 1;
    }

    public List<String> collectErrors() {
        List<String> errors = new ArrayList<>();
        if (bull == null) {
            errors.add("structure.detection.bull is missing");
        } else {
            bull.collectErrors("structure.detection.bull", errors);
        }
        if (bear == null) {
            errors.add("structure.detection.bear is missing");
        } else {
            bear.collectErrors("structure.detection.bear", errors);
        }
        if (lookback < 1) {
            errors.add("structure.detection.lookback must be at least 1, got " + lookback);
        }
        if (maxPairDistance < 1) {
            errors.add("structure.detection.max-pair-distance must be at least 1, got " + maxPairDistance);
        } else if (maxPairDistance < lookback) {
            errors.add("structure.detection.max-pair-distance (" + maxPairDistance
                    + ") must not be smaller than lookback (" + lookback + ")");
        }
        if (!(staleExtension > 0) || !Double.isFinite(staleExtension)) {
            errors.add("structure.detection.stale-extension must be positive, got " + staleExtension);
        }
        return errors;
    }

    /**
     * @throws InvalidConfigurationException listing every problem found
     */
    public void validate() {
        List<String> errors = collectErrors();
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(errors);
        }
    }

    /**
     * Deep copy so a running detector is isolated from property rebinding.
     */
    public DetectionConfig copy() {
        DetectionConfig copy = new DetectionConfig();
        copy.setBull(bull == null ? null : bull.copy());
        copy.setBear(bear == null ? null : bear.copy());
        copy.setLookback(lookback);
        copy.setMaxPairDistance(maxPairDistance);
        copy.setStaleExtension(staleExtension);
        copy.setInvariantChecks(invariantChecks);
        return copy;
    }
}
