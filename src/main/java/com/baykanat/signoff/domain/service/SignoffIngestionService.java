package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.domain.mapper.SignoffEventMapper;
import com.baykanat.signoff.domain.model.SignoffEvent;
import com.baykanat.signoff.infrastructure.persistence.InboxJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.SignoffEventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Kafka consumer tarafı: inbox ile dedup, ardından signoff_events tablosuna append. Tek transaction.
 * Daha önce alınmış bir event is_deleted=true ile tekrar gelirse mevcut satır soft-delete edilir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignoffIngestionService {

    private final SignoffEventJdbcRepository signoffEventRepository;
    private final InboxJdbcRepository inboxRepository;
    private final IdempotencyService idempotencyService;
    private final SignoffEventMapper signoffEventMapper;

    /** Batch'i tek transaction'da işler: inbox'ta olmayanları inbox + signoff_events'e yazar. Uygulanan mesaj sayısını döner. */
    @Transactional
    public int processBatch(List<SignoffEventRequest> events) {
        if (events.isEmpty()) {
            return 0;
        }

        // Inbox key'i is_deleted içerir; aynı batch içindeki birebir tekrarlar burada tekilleşir
        Map<String, SignoffEventRequest> keyToEvent = new LinkedHashMap<>();
        for (SignoffEventRequest event : events) {
            keyToEvent.putIfAbsent(idempotencyService.generateInboxKey(event), event);
        }

        Set<String> existingKeys = inboxRepository.findExistingKeys(keyToEvent.keySet());
        if (!existingKeys.isEmpty()) {
            log.debug("Deduplicating {} out of {} signoff events", existingKeys.size(), events.size());
        }

        Map<String, SignoffEventRequest> newEvents = keyToEvent.entrySet().stream()
                .filter(entry -> !existingKeys.contains(entry.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        if (newEvents.isEmpty()) {
            log.debug("All {} signoff events were duplicates, skipping batch", events.size());
            return 0;
        }

        inboxRepository.batchInsert(newEvents.keySet());

        List<SignoffEvent> domainEvents = newEvents.entrySet().stream()
                .map(entry -> signoffEventMapper.toSignoffEvent(
                        entry.getValue(), idempotencyService.generateKey(entry.getValue())))
                .toList();
        signoffEventRepository.batchInsert(domainEvents);

        log.info("Processed signoff batch: {} new events applied, {} duplicates skipped",
                newEvents.size(), events.size() - newEvents.size());
        return newEvents.size();
    }
}
