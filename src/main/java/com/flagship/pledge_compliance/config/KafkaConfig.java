package com.flagship.pledge_compliance.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for celebration events. Keyed by celebration id, so events of one
 * pledge stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.celebrations:celebrations}")
    private String celebrationsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic celebrationsTopic() {
        return TopicBuilder.name(celebrationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
