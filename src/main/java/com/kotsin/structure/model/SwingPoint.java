package com.kotsin.structure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Confirmed swing high or swing low.
 * Confirmation lags the bar by the configured lookback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SwingPoint {

    private int barIndex;
    private double price;
    private boolean high;
    private int confirmedAtBar;

    /**
     * Direction of a leg that starts at this point: lows originate bull legs,
     * highs originate bear legs.
     */
    public Direction originatedDirection() {
        return high ? Direction.BEAR : Direction.BULL;
    }
}
