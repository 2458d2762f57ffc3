package com.kotsin.structure.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OHLC bar.
 *
 * {@code index} is assigned by the detector on ingestion (0-based, sequential);
 * callers only provide timestamp and prices.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bar {

    private int index;
    private long timestamp;     // epoch millis
    private double open;
    private double high;
    private double low;
    private double close;

    public static Bar of(long timestamp, double open, double high, double low, double close) {
        return Bar.builder()
                .timestamp(timestamp)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .build();
    }

    public Bar withIndex(int newIndex) {
        return toBuilder().index(newIndex).build();
    }
}
