package com.kotsin.structure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Structure detector configuration.
 *
 * Properties can be overridden via application.yml:
 * structure:
 *   detection:
 *     lookback: 2
 *     bull:
 *       formation-threshold: 0.382
 *   kafka:
 *     input-topic: ohlc-bars-1m
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "structure")
public class StructureProperties {

    private DetectionConfig detection = new DetectionConfig();

    private Kafka kafka = new Kafka();

    @Data
    public static class Kafka {

        /**
         * Topic carrying OHLC bars as JSON {symbol, timestamp, open, high, low, close}
         */
        private String inputTopic = "ohlc-bars-1m";

        /**
         * Topic receiving structural events keyed by symbol
         */
        private String outputTopic = "structure-events";

        private String groupId = "structure-detector";

        /**
         * Start the bar listener with the application context
         */
        private boolean enabled = true;
    }
}
