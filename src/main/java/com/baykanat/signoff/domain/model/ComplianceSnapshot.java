package com.baykanat.signoff.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/** Tek koşuda okunan tüm girdi tabloları; hesaplama boyunca değişmez. */
@Getter
@Builder
public class ComplianceSnapshot {

    @Singular
    private final List<BookingContract> contracts;
    @Singular
    private final List<SignoffEvent> events;
    @Singular
    private final List<ResponsibleUser> responsibleUsers;
    @Singular
    private final List<DcUser> users;
    @Singular("hierarchyEntry")
    private final List<OrgHierarchyEntry> hierarchy;
    private final ReferenceData referenceData;
}
