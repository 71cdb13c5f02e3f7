package com.flagship.gate_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.gate-events:gate-events}")
    private String gateEventsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Creates the gate events topic if it doesn't exist. Events are keyed by
     * regNo, so per-person ordering holds with any partition count.
     */
    @Bean
    public NewTopic gateEventsTopic() {
        return TopicBuilder.name(gateEventsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
