package com.baykanat.signoff.config;

import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Signoff consumer hata işleme: exponential backoff retry, ardından DLT'ye gönderim. */
@Configuration
public class KafkaConsumerConfig {

    @Value("${app.kafka.topic.signoff-events}")
    private String signoffEventsTopic;

    @SuppressWarnings("null")
    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        // Başarısız batch → topic.DLT, aynı partition
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(signoffEventsTopic + ".DLT", record.partition())
        );

        // DB geçici hataları için 1s → 2s → 4s, toplam 7 sn
        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(7000L);

        return new DefaultErrorHandler(recoverer, backOff);
    }
}
