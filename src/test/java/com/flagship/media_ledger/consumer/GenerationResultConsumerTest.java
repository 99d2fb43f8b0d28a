package com.flagship.media_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.media_ledger.creation.CreationNotFoundException;
import com.flagship.media_ledger.creation.CreationService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationResultConsumerTest {

    @Mock
    private IdempotentEventProcessor eventProcessor;
    @Mock
    private CreationService creationService;
    @Mock
    private Acknowledgment ack;

    private GenerationResultConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new GenerationResultConsumer(eventProcessor, creationService, new ObjectMapper().findAndRegisterModules());
    }

    private void runHandlersInline() {
        when(eventProcessor.processEvent(any(UUID.class), anyString(), eq("Creation"), any(UUID.class),
                eq(GenerationResultConsumer.CONSUMER_GROUP), any(Runnable.class)))
            .thenAnswer(inv -> {
                inv.<Runnable>getArgument(5).run();
                return true;
            });
    }

    private static ConsumerRecord<String, String> record(String json) {
        return new ConsumerRecord<>("generation-results", 0, 42L, "key", json);
    }

    @Test
    @DisplayName("Completed result marks the creation READY with its output and acknowledges")
    void completedResult() {
        runHandlersInline();
        UUID creationId = UUID.randomUUID();
        String json = """
            {"eventId":"%s","creationId":"%s","eventType":"GenerationCompleted",
             "outputRef":"creations/u1/%s.png"}
            """.formatted(UUID.randomUUID(), creationId, creationId);

        consumer.consume(record(json), ack);

        verify(creationService).complete(creationId, "creations/u1/" + creationId + ".png");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Failed result uses the classified error as the failure reason")
    void failedResult() {
        runHandlersInline();
        UUID creationId = UUID.randomUUID();
        String json = """
            {"eventId":"%s","creationId":"%s","eventType":"GenerationFailed",
             "errorType":"content_policy_block","message":"nsfw prompt"}
            """.formatted(UUID.randomUUID(), creationId);

        consumer.consume(record(json), ack);

        verify(creationService).fail(creationId, "CONTENT_POLICY_BLOCK: nsfw prompt");
    }

    @Test
    void startedResult() {
        runHandlersInline();
        UUID creationId = UUID.randomUUID();

        consumer.handle(GenerationResultEvent.builder()
            .eventId(UUID.randomUUID())
            .creationId(creationId)
            .eventType(GenerationResultEvent.STARTED)
            .build());

        verify(creationService).markProcessing(creationId);
    }

    @Test
    @DisplayName("Result for an unknown creation is recorded as skipped")
    void unknownCreationSkipped() {
        UUID creationId = UUID.randomUUID();
        UUID eventId = UUID.randomUUID();
        when(eventProcessor.processEvent(eq(eventId), anyString(), anyString(), eq(creationId), anyString(), any()))
            .thenThrow(new CreationNotFoundException(creationId));

        consumer.handle(GenerationResultEvent.builder()
            .eventId(eventId)
            .creationId(creationId)
            .eventType(GenerationResultEvent.COMPLETED)
            .outputRef("x")
            .build());

        verify(eventProcessor).skipEvent(eventId, GenerationResultEvent.COMPLETED, "Creation", creationId,
            GenerationResultConsumer.CONSUMER_GROUP, "Unknown creation");
    }

    @Test
    void unknownTypeSkipped() {
        UUID eventId = UUID.randomUUID();
        UUID creationId = UUID.randomUUID();

        consumer.handle(GenerationResultEvent.builder()
            .eventId(eventId).creationId(creationId).eventType("GenerationPaused").build());

        verify(eventProcessor).skipEvent(eq(eventId), eq("GenerationPaused"), eq("Creation"), eq(creationId),
            eq(GenerationResultConsumer.CONSUMER_GROUP), anyString());
        verify(eventProcessor, never()).processEvent(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Unparseable message is acknowledged so it does not block the partition")
    void poisonMessageAcknowledged() {
        consumer.consume(record("not json"), ack);

        verify(ack).acknowledge();
        verify(eventProcessor, never()).processEvent(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Handler failure leaves the message unacknowledged for redelivery")
    void failureNotAcknowledged() {
        runHandlersInline();
        UUID creationId = UUID.randomUUID();
        when(creationService.complete(eq(creationId), anyString())).thenThrow(new IllegalStateException("db down"));
        String json = """
            {"eventId":"%s","creationId":"%s","eventType":"GenerationCompleted","outputRef":"o"}
            """.formatted(UUID.randomUUID(), creationId);

        assertThrows(IllegalStateException.class, () -> consumer.consume(record(json), ack));
        verify(ack, never()).acknowledge();
    }
}
