package com.kotsin.structure.infrastructure.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.exception.StructureDetectionException;
import com.kotsin.structure.logging.DetectionTraceLogger;
import com.kotsin.structure.service.StructureDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * BarStreamConsumer - feeds OHLC bars from Kafka into the per-symbol detectors.
 *
 * Bad input (unparseable JSON, missing fields, malformed or out-of-order bars)
 * is logged and dropped. Invariant violations are defects and propagate.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BarStreamConsumer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final StructureDetectionService detectionService;
    private final StructureEventPublisher publisher;
    private final DetectionTraceLogger traceLogger;

    @KafkaListener(
            topics = "${structure.kafka.input-topic:ohlc-bars-1m}",
            groupId = "${structure.kafka.group-id:structure-detector}",
            containerFactory = "barListenerContainerFactory",
            autoStartup = "${structure.kafka.enabled:true}"
    )
    public void onBar(String payload) {
        BarMessage message;
        try {
            message = MAPPER.readValue(payload, BarMessage.class);
        } catch (JsonProcessingException e) {
            traceLogger.logRejected("?", "unparseable bar: " + e.getOriginalMessage());
            return;
        }
        if (message == null || !message.isComplete()) {
            traceLogger.logRejected(message == null ? "?" : String.valueOf(message.getSymbol()),
                    "incomplete bar: " + message);
            return;
        }

        String symbol = message.getSymbol();
        try {
            List<StructureEvent> events = detectionService.processBar(symbol, message.toBar());
            publisher.publish(symbol, events);
        } catch (StructureDetectionException e) {
            if (e.isInputError()) {
                traceLogger.logRejected(symbol, e.getErrorCode() + ": " + e.getMessage());
                return;
            }
            log.error("Structure detection failed for {} at {}: {}", symbol, message.getTimestamp(), e.getMessage(), e);
            throw e;
        }
    }
}
