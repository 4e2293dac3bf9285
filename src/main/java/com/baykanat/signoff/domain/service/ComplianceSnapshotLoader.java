package com.baykanat.signoff.domain.service;

import com.baykanat.signoff.domain.model.ComplianceSnapshot;
import com.baykanat.signoff.infrastructure.persistence.SignoffEventJdbcRepository;
import com.baykanat.signoff.infrastructure.persistence.SnapshotJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/** Koşu girdilerini tek bir REPEATABLE READ transaction'da okur; tüm tablolar aynı anın görüntüsüdür. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceSnapshotLoader {

    private final SnapshotJdbcRepository snapshotRepository;
    private final SignoffEventJdbcRepository signoffEventRepository;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ComplianceSnapshot load() {
        long start = System.currentTimeMillis();
        ComplianceSnapshot snapshot = ComplianceSnapshot.builder()
                .contracts(snapshotRepository.findContracts())
                .events(signoffEventRepository.findAll())
                .responsibleUsers(snapshotRepository.findResponsibleUsers())
                .users(snapshotRepository.findUsers())
                .hierarchy(snapshotRepository.findHierarchy())
                .referenceData(snapshotRepository.loadReferenceData())
                .build();

        log.info("Snapshot loaded in {}ms: {} contracts, {} signoff events, {} responsible users, {} users, {} hierarchy rows",
                System.currentTimeMillis() - start, snapshot.getContracts().size(), snapshot.getEvents().size(),
                snapshot.getResponsibleUsers().size(), snapshot.getUsers().size(), snapshot.getHierarchy().size());
        return snapshot;
    }
}
