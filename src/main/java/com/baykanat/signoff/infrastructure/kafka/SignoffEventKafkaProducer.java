package com.baykanat.signoff.infrastructure.kafka;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Signoff event'lerini Kafka'ya yazar; Retry + Circuit Breaker. Partition key booking contract,
 * böylece aynı kontratın event'leri aynı partition'da sıralı tüketilir.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignoffEventKafkaProducer {

    private static final int RETRY_AFTER_SECONDS = 30;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Tek event gönderir ve broker ack'ini bekler. */
    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleSendFailure")
    public void send(SignoffEventRequest event) throws Exception {
        kafkaTemplate.send(topic(), key(event), event).get(1, TimeUnit.SECONDS);
    }

    /** Toplu gönderim: tüm send'ler paralel başlar, ack'ler birlikte beklenir. */
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleBatchSendFailure")
    public void sendBatch(List<SignoffEventRequest> events) throws Exception {
        String topic = topic();
        List<CompletableFuture<SendResult<String, Object>>> futures = events.stream()
                .map(event -> kafkaTemplate.send(topic, key(event), event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(10, TimeUnit.SECONDS);
    }

    private String topic() {
        return Objects.requireNonNull(appProperties.getKafka().getTopic().getSignoffEvents(), "signoffEvents topic");
    }

    private static String key(SignoffEventRequest event) {
        return Objects.requireNonNull(event.getBookingContract(), "bookingContract");
    }

    @SuppressWarnings("unused")
    private void handleSendFailure(SignoffEventRequest event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting signoff event for booking_contract={}",
                event.getBookingContract());
        throw new ServiceUnavailableException(
                "Signoff ingestion is temporarily unavailable. Kafka circuit breaker is open.", RETRY_AFTER_SECONDS);
    }

    /** Retry'lar tükendikten sonra. */
    @SuppressWarnings("unused")
    private void handleSendFailure(SignoffEventRequest event, Exception ex) {
        log.error("Kafka produce failed after all retries for booking_contract={}: {}",
                event.getBookingContract(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Signoff ingestion is temporarily unavailable. " + ex.getMessage(), RETRY_AFTER_SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleBatchSendFailure(List<SignoffEventRequest> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting batch of {} signoff events", events.size());
        throw new ServiceUnavailableException(
                "Signoff ingestion is temporarily unavailable. Kafka circuit breaker is open.", RETRY_AFTER_SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleBatchSendFailure(List<SignoffEventRequest> events, Exception ex) {
        log.error("Kafka batch produce failed for {} signoff events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Signoff ingestion is temporarily unavailable. " + ex.getMessage(), RETRY_AFTER_SECONDS);
    }

    /** Kafka erişilemez veya circuit breaker açık; GlobalExceptionHandler 503 + Retry-After döner. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
