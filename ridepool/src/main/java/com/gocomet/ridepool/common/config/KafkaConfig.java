package com.gocomet.ridepool.common.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * trip-events: lifecycle log of requests and pooled trips, keyed by tripId (requestId
 * before booking). Partition count is sized for local dev.
 */
@Configuration
public class KafkaConfig {

    @Value("${app.kafka.topics.trip-events}")
    private String tripEventsTopic;

    @Value("${app.kafka.topics.partitions:2}")
    private int partitions;

    @Bean
    public NewTopic tripEventsTopic() {
        return TopicBuilder.name(tripEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
