package com.flagship.media_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.media_ledger.creation.CreationNotFoundException;
import com.flagship.media_ledger.creation.CreationService;
import com.flagship.media_ledger.creation.GenerationErrorType;
import com.flagship.media_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Applies worker status reports to creations.
 *
 * Offsets are committed only after the report is applied; an exception
 * leaves the record for redelivery, and the processed_events table keeps
 * the replay from applying it twice.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class GenerationResultConsumer {

    static final String CONSUMER_GROUP = "creation-result-consumer";
    private static final String AGGREGATE_TYPE = "Creation";

    private final IdempotentEventProcessor eventProcessor;
    private final CreationService creationService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.generation-results:generation-results}",
        groupId = "${spring.kafka.consumer.group-id:media-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received generation result: partition={}, offset={}, key={}",
            record.partition(), record.offset(), record.key());

        GenerationResultEvent event = parse(record.value());
        if (event == null) {
            log.warn("Unparseable generation result at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try (MDC.MDCCloseable correlation = CorrelationContext.withMdc(
                 CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId(record));
             MDC.MDCCloseable creation = CorrelationContext.withMdc(
                 CorrelationContext.CREATION_ID_MDC_KEY, event.getCreationId())) {
            handle(event);
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Failed to apply generation result {} at offset {}: {}",
                event.getEventId(), record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    void handle(GenerationResultEvent event) {
        Runnable action = switch (event.getEventType()) {
            case GenerationResultEvent.STARTED ->
                () -> creationService.markProcessing(event.getCreationId());
            case GenerationResultEvent.COMPLETED ->
                () -> creationService.complete(event.getCreationId(), event.getOutputRef());
            case GenerationResultEvent.FAILED ->
                () -> creationService.fail(event.getCreationId(), failureReason(event));
            default -> null;
        };

        if (action == null) {
            skip(event, "Unknown event type " + event.getEventType());
            return;
        }

        try {
            boolean processed = eventProcessor.processEvent(event.getEventId(), event.getEventType(),
                AGGREGATE_TYPE, event.getCreationId(), CONSUMER_GROUP, action);
            if (processed) {
                log.info("Applied {} to creation {}", event.getEventType(), event.getCreationId());
            }
        } catch (CreationNotFoundException e) {
            log.warn("Generation result {} refers to unknown creation {}",
                event.getEventId(), event.getCreationId());
            skip(event, "Unknown creation");
        }
    }

    private void skip(GenerationResultEvent event, String reason) {
        eventProcessor.skipEvent(event.getEventId(), event.getEventType(),
            AGGREGATE_TYPE, event.getCreationId(), CONSUMER_GROUP, reason);
    }

    private static String failureReason(GenerationResultEvent event) {
        GenerationErrorType type = GenerationErrorType.fromWireValue(event.getErrorType());
        if (type == null) {
            return event.getMessage() != null && !event.getMessage().isBlank()
                ? event.getMessage()
                : "generation failed";
        }
        return type.describe(event.getMessage());
    }

    private GenerationResultEvent parse(String json) {
        try {
            GenerationResultEvent event = objectMapper.readValue(json, GenerationResultEvent.class);
            if (event.getEventId() == null || event.getCreationId() == null || event.getEventType() == null) {
                log.warn("Generation result is missing eventId, creationId or eventType");
                return null;
            }
            return event;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse generation result: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String correlationId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header != null
            ? new String(header.value(), StandardCharsets.UTF_8)
            : CorrelationContext.generateCorrelationId();
    }
}
