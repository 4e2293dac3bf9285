package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.domain.mapper.SignoffEventMapper;
import com.baykanat.signoff.domain.model.SignoffEvent;
import com.baykanat.signoff.infrastructure.persistence.InboxJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.SignoffEventJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * SignoffIngestionService unit testleri: inbox ile dedup, event deposuna append ve
 * boş / tamamen tekrar eden batch'ler.
 */
@ExtendWith(MockitoExtension.class)
class SignoffIngestionServiceTest {

    @Mock
    private SignoffEventJdbcRepository signoffEventRepository;

    @Mock
    private InboxJdbcRepository inboxRepository;

    private final IdempotencyService idempotencyService = new IdempotencyService();

    private SignoffIngestionService service;

    @BeforeEach
    void setUp() {
        SignoffEventMapper mapper = Mappers.getMapper(SignoffEventMapper.class);
        service = new SignoffIngestionService(signoffEventRepository, inboxRepository, idempotencyService, mapper);
    }

    @Test
    @DisplayName("Process batch - new signoffs are written to inbox and appended to the event store")
    @SuppressWarnings("unchecked")
    void processBatchAppendsNewSignoffs() {
        SignoffEventRequest request = signoff("BC-1", 10L);
        when(inboxRepository.findExistingKeys(anyCollection())).thenReturn(Collections.emptySet());

        int inserted = service.processBatch(List.of(request));

        assertThat(inserted).isEqualTo(1);
        verify(inboxRepository).batchInsert(anyCollection());

        ArgumentCaptor<List<SignoffEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(signoffEventRepository).batchInsert(captor.capture());
        assertThat(captor.getValue()).singleElement().satisfies(event -> {
            assertThat(event.getBookingContract()).isEqualTo("BC-1");
            assertThat(event.getIdempotencyKey()).isEqualTo(idempotencyService.generateKey(request));
            assertThat(event.isDeleted()).isFalse();
        });
    }

    @Test
    @DisplayName("Process batch - signoffs already in the inbox are skipped")
    void processBatchSkipsDuplicates() {
        SignoffEventRequest request = signoff("BC-1", 10L);
        when(inboxRepository.findExistingKeys(anyCollection()))
                .thenReturn(Set.of(idempotencyService.generateInboxKey(request)));

        int inserted = service.processBatch(List.of(request));

        assertThat(inserted).isZero();
        verify(inboxRepository, never()).batchInsert(anyCollection());
        verify(signoffEventRepository, never()).batchInsert(anyList());
    }

    @Test
    @DisplayName("Process batch - mixed new and already ingested signoffs")
    void processBatchHandlesMixedBatch() {
        SignoffEventRequest fresh = signoff("BC-1", 10L);
        SignoffEventRequest seen = signoff("BC-2", 20L);
        when(inboxRepository.findExistingKeys(anyCollection()))
                .thenReturn(Set.of(idempotencyService.generateInboxKey(seen)));

        int inserted = service.processBatch(List.of(fresh, seen));

        assertThat(inserted).isEqualTo(1);
        verify(signoffEventRepository).batchInsert(argThat(list -> list.size() == 1
                && "BC-1".equals(list.get(0).getBookingContract())));
    }

    @Test
    @DisplayName("Process batch - the same signoff twice in one batch is appended once")
    void processBatchCollapsesInBatchDuplicates() {
        when(inboxRepository.findExistingKeys(anyCollection())).thenReturn(Collections.emptySet());

        int inserted = service.processBatch(List.of(signoff("BC-1", 10L), signoff("BC-1", 10L)));

        assertThat(inserted).isEqualTo(1);
        verify(inboxRepository).findExistingKeys(argThat(keys -> keys.size() == 1));
    }

    @Test
    @DisplayName("Process batch - a re-sent signoff marked deleted passes the inbox and keeps the event's key")
    @SuppressWarnings("unchecked")
    void processBatchAppliesResentDeletion() {
        SignoffEventRequest live = signoff("BC-1", 10L);
        SignoffEventRequest deleted = signoff("BC-1", 10L);
        deleted.setDeleted(true);
        when(inboxRepository.findExistingKeys(anyCollection()))
                .thenReturn(Set.of(idempotencyService.generateInboxKey(live)));

        int applied = service.processBatch(List.of(deleted));

        assertThat(applied).isEqualTo(1);
        verify(inboxRepository).batchInsert(argThat(keys -> keys.size() == 1
                && keys.contains(idempotencyService.generateInboxKey(deleted))));

        ArgumentCaptor<List<SignoffEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(signoffEventRepository).batchInsert(captor.capture());
        assertThat(captor.getValue()).singleElement().satisfies(event -> {
            assertThat(event.isDeleted()).isTrue();
            assertThat(event.getIdempotencyKey()).isEqualTo(idempotencyService.generateKey(live));
        });
    }

    @Test
    @DisplayName("Process batch - live and deleted versions of a signoff in one batch are both applied")
    void processBatchKeepsLiveAndDeletedVersions() {
        SignoffEventRequest live = signoff("BC-1", 10L);
        SignoffEventRequest deleted = signoff("BC-1", 10L);
        deleted.setDeleted(true);
        when(inboxRepository.findExistingKeys(anyCollection())).thenReturn(Collections.emptySet());

        int applied = service.processBatch(List.of(live, deleted));

        assertThat(applied).isEqualTo(2);
        verify(signoffEventRepository).batchInsert(argThat(list -> list.size() == 2
                && list.get(0).getIdempotencyKey().equals(list.get(1).getIdempotencyKey())
                && !list.get(0).isDeleted() && list.get(1).isDeleted()));
    }

    @Test
    @DisplayName("Process batch - empty list returns 0 without DB calls")
    void processBatchHandlesEmptyList() {
        int inserted = service.processBatch(Collections.emptyList());

        assertThat(inserted).isZero();
        verifyNoInteractions(signoffEventRepository, inboxRepository);
    }

    private static SignoffEventRequest signoff(String contract, long userId) {
        return SignoffEventRequest.builder()
                .bookingContract(contract)
                .dcUserId(userId)
                .createDtm(LocalDateTime.of(2024, 5, 14, 10, 15, 30))
                .signoffMethodId(2)
                .signOffIdentityId(1)
                .deferSignoffReasonId(0)
                .dcEngagementId(9001L)
                .signoffEventId(1)
                .notes("Quarterly review")
                .build();
    }
}
