package com.kotsin.structure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on invalid detection or messaging configuration,
 * before the first bar reaches a detector.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final StructureProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        log.info("Validating structure detector configuration...");

        List<String> errors = collectErrors();

        if (!errors.isEmpty()) {
            log.error("Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed. Please fix the errors above.");
        }

        log.info("Configuration validation passed");
        logConfigurationSummary();
    }

    List<String> collectErrors() {
        List<String> errors = new ArrayList<>();

        if (properties.getDetection() == null) {
            errors.add("structure.detection is not configured");
        } else {
            errors.addAll(properties.getDetection().collectErrors());
        }

        StructureProperties.Kafka kafka = properties.getKafka();
        if (kafka == null || isNullOrEmpty(kafka.getInputTopic())) {
            errors.add("structure.kafka.input-topic is not configured");
        }
        if (kafka == null || isNullOrEmpty(kafka.getOutputTopic())) {
            errors.add("structure.kafka.output-topic is not configured");
        }
        return errors;
    }

    private void logConfigurationSummary() {
        DetectionConfig detection = properties.getDetection();
        log.info("Configuration Summary:");
        log.info("  Input topic: {}", properties.getKafka().getInputTopic());
        log.info("  Output topic: {}", properties.getKafka().getOutputTopic());
        log.info("  Lookback: {} | Max pair distance: {} | Stale extension: {}",
                detection.getLookback(), detection.getMaxPairDistance(), detection.getStaleExtension());
        log.info("  Bull: {}", detection.getBull());
        log.info("  Bear: {}", detection.getBear());
    }

    private boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
