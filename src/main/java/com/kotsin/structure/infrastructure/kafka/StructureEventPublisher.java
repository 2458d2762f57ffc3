package com.kotsin.structure.infrastructure.kafka;

import com.kotsin.structure.config.StructureProperties;
import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.logging.DetectionTraceLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes structural events keyed by symbol, in emission order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StructureEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final StructureProperties properties;
    private final DetectionTraceLogger traceLogger;

    public void publish(String symbol, List<StructureEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        String topic = properties.getKafka().getOutputTopic();
        for (StructureEvent event : events) {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, symbol, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("[EVENT_PUB] Failed to publish {} leg={} for {} to {}: {}",
                            event.getType(), event.getLegId(), symbol, topic, ex.getMessage());
                }
            });
        }
        traceLogger.logPublished(symbol, events.size(), topic);
    }
}
