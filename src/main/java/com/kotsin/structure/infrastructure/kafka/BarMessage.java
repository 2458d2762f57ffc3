package com.kotsin.structure.infrastructure.kafka;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.structure.model.Bar;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire format of an incoming bar: {symbol, timestamp, open, high, low, close}.
 * Prices are boxed so a missing field is distinguishable from zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BarMessage {

    private String symbol;
    private Long timestamp;     // epoch millis
    private Double open;
    private Double high;
    private Double low;
    private Double close;

    public boolean isComplete() {
        return symbol != null && !symbol.isBlank()
                && timestamp != null && open != null && high != null && low != null && close != null;
    }

    public Bar toBar() {
        return Bar.of(timestamp, open, high, low, close);
    }
}
