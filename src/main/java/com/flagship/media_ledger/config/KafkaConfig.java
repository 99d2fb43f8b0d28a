package com.flagship.media_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics exchanged with the generation workers.
 *
 * Tasks are keyed by creation id, so all messages for one creation land on
 * the same partition and are seen in order by a single worker.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.generation-tasks:generation-tasks}")
    private String generationTasksTopic;

    @Value("${kafka.topic.generation-results:generation-results}")
    private String generationResultsTopic;

    @Bean
    public NewTopic generationTasksTopic() {
        return TopicBuilder.name(generationTasksTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic generationResultsTopic() {
        return TopicBuilder.name(generationResultsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
