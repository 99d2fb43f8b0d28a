package com.flagship.media_ledger.creation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.media_ledger.common.exception.EnqueueFailureException;
import com.flagship.media_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands generation tasks to the workers.
 *
 * The send is synchronous: the caller has already charged the user and
 * must know whether the task was accepted before answering the request.
 */
@Component
@Slf4j
public class GenerationTaskPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration timeout;

    public GenerationTaskPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                   ObjectMapper objectMapper,
                                   @Value("${kafka.topic.generation-tasks:generation-tasks}") String topic,
                                   @Value("${kafka.publish-timeout:5s}") Duration timeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.timeout = timeout;
    }

    /**
     * @throws EnqueueFailureException if the broker did not acknowledge the task in time
     */
    public void publish(GenerationTask task) {
        String key = task.getCreationId().toString();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new EnqueueFailureException("Failed to serialize generation task " + key, e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
            CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

        try {
            SendResult<String, String> result = kafkaTemplate.send(record)
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Published generation task {} to {}-{}@{}", key, topic,
                result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnqueueFailureException("Interrupted while enqueueing generation task " + key, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EnqueueFailureException("Failed to enqueue generation task " + key, e);
        } catch (org.springframework.kafka.KafkaException | org.apache.kafka.common.KafkaException e) {
            throw new EnqueueFailureException("Failed to enqueue generation task " + key, e);
        }
    }
}
