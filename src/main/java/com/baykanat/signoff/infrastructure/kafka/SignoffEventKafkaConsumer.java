package com.baykanat.signoff.infrastructure.kafka;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.domain.mapper.SignoffEventMapper;
import com.baykanat.signoff.domain.service.SignoffIngestionService;
import com.baykanat.signoff.infrastructure.metrics.ComplianceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.serializer.SerializationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** signoff-events topic'inden batch tüketir; bozuk kayıtlar DLT'ye, geçerliler SignoffIngestionService'e. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignoffEventKafkaConsumer {

    private final SignoffIngestionService ingestionService;
    private final SignoffEventMapper signoffEventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ComplianceMetrics metrics;

    @Value("${app.kafka.topic.signoff-events}")
    private String signoffEventsTopic;

    /** Batch'i işler, ardından manuel ack. DB hatası exception olarak container'a döner ve retry/DLT uygulanır. */
    @KafkaListener(
            topics = "${app.kafka.topic.signoff-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} records from signoff-events topic", records.size());

        List<SignoffEventRequest> events = new ArrayList<>(records.size());
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            // ErrorHandlingDeserializer: value null, sebep header'da
            if (record.headers().lastHeader(SerializationUtils.VALUE_DESERIALIZER_EXCEPTION_HEADER) != null) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                SignoffEventRequest event = signoffEventMapper.fromRecordValue(record.value());
                if (event != null) {
                    events.add(event);
                }
            } catch (IllegalArgumentException e) {
                log.error("Failed to convert record at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (!events.isEmpty()) {
            int inserted = ingestionService.processBatch(events);
            metrics.recordIngested(inserted, events.size() - inserted);
            log.info("Signoff batch processed: {} records received, {} converted, {} appended, {} sent to DLT",
                    records.size(), events.size(), inserted, dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch failed conversion, {} sent to DLT", records.size(), dltCount);
        }

        acknowledgment.acknowledge();
    }

    /** DLT'ye yazılamazsa sadece log; batch'in geri kalanı devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String dltTopic = Objects.requireNonNull(signoffEventsTopic, "signoffEventsTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(dltTopic, key, record.value());
            metrics.recordDeadLettered();
            log.warn("Sent failed record to DLT: topic={}, offset={}, partition={}, reason={}",
                    dltTopic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", dltTopic, dltEx.getMessage());
        }
    }
}
