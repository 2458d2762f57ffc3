package com.kotsin.structure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Arrays;

/**
 * Swing - formed leg snapshot with Fibonacci levels.
 *
 * Holds its own copies of the leg coordinates so it survives the leg's
 * invalidation. Only {@link #status} changes after creation, and only as a
 * mirror of the anchoring leg.
 *
 * Levels are expressed in the leg's frame: 0 = origin, 1 = pivot, 2 = target.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class Swing {

    public static final double[] LEVEL_RATIOS = {0.382, 0.5, 0.618, 1.0, 1.382, 1.618, 2.0};

    private long legId;
    private Direction direction;
    private double originPrice;
    private int originIndex;
    private double pivotPrice;
    private int pivotIndex;
    private int formedAtBar;
    private long formedAtTimestamp;

    /** Prices at {@link #LEVEL_RATIOS}, same order. */
    private double[] levelPrices;

    private SwingStatus status;

    public double getRange() {
        return Math.abs(pivotPrice - originPrice);
    }

    /**
     * @throws IllegalArgumentException for a ratio outside {@link #LEVEL_RATIOS}
     */
    public double levelPrice(double ratio) {
        for (int i = 0; i < LEVEL_RATIOS.length; i++) {
            if (LEVEL_RATIOS[i] == ratio) {
                return levelPrices[i];
            }
        }
        throw new IllegalArgumentException("No Fibonacci level at ratio " + ratio
                + "; known levels " + Arrays.toString(LEVEL_RATIOS));
    }

    public double[] getLevelPrices() {
        return levelPrices == null ? null : levelPrices.clone();
    }

    public void mirrorStatus(SwingStatus legStatus) {
        this.status = legStatus;
    }
}
