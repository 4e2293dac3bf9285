package com.baykanat.signoff.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** Signoff topic ve DLT bean'leri. Key booking contract olduğu için bir kontratın event'leri sıralı kalır. */
@Configuration
public class KafkaProducerConfig {

    @Value("${app.kafka.topic.signoff-events}")
    private String signoffEventsTopic;

    /** Attestation akışı düşük hacimli; 3 partition yeterli. */
    @Bean
    public NewTopic signoffEventsTopic() {
        return TopicBuilder.name(Objects.requireNonNull(signoffEventsTopic, "signoffEventsTopic"))
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic signoffEventsDlt() {
        return TopicBuilder.name(Objects.requireNonNull(signoffEventsTopic, "signoffEventsTopic") + ".DLT")
                .partitions(3)
                .replicas(1)
                .build();
    }
}
