package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.BookingContract;
import com.baykanat.signoff.domain.model.ComplianceSnapshot;
import com.baykanat.signoff.domain.model.DcUser;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.ReferenceData;
import com.baykanat.signoff.domain.model.ResponsibleUser;
import com.baykanat.signoff.domain.model.SignoffEvent;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Snapshot üzerinde koşu başına bir kez kurulan lookup'lar; dört pipeline bunu paylaşır. */
public class SnapshotIndex {

    @Getter
    private final ComplianceSnapshot snapshot;
    @Getter
    private final OrgAttributionResolver attributionResolver;
    @Getter
    private final Set<String> touchedContracts;

    private final Map<String, List<SignoffEvent>> liveEventsByContract = new HashMap<>();
    private final Map<String, List<Long>> responsibleUsersByContract = new HashMap<>();
    private final Map<Long, DcUser> usersById = new HashMap<>();

    public SnapshotIndex(ComplianceSnapshot snapshot, String hierarchyEmailDomain, NeverSignoffDetector detector) {
        this.snapshot = snapshot;
        this.attributionResolver = new OrgAttributionResolver(snapshot.getUsers(), snapshot.getHierarchy(), hierarchyEmailDomain);
        this.touchedContracts = detector.touchedContracts(snapshot.getEvents());

        for (SignoffEvent event : snapshot.getEvents()) {
            if (!event.isDeleted() && event.getBookingContract() != null) {
                liveEventsByContract.computeIfAbsent(event.getBookingContract(), k -> new ArrayList<>()).add(event);
            }
        }
        for (ResponsibleUser assignment : snapshot.getResponsibleUsers()) {
            if (!assignment.isDeleted()) {
                responsibleUsersByContract.computeIfAbsent(assignment.getBookingContract(), k -> new ArrayList<>())
                        .add(assignment.getDcUserId());
            }
        }
        for (DcUser user : snapshot.getUsers()) {
            usersById.putIfAbsent(user.getUserId(), user);
        }
    }

    public Collection<BookingContract> contracts() {
        return snapshot.getContracts();
    }

    public ReferenceData reference() {
        return snapshot.getReferenceData();
    }

    /** Kontratın silinmemiş event'leri, snapshot sırasıyla. */
    public List<SignoffEvent> liveEvents(String bookingContract) {
        return liveEventsByContract.getOrDefault(bookingContract, List.of());
    }

    /** Silinme durumuna bakılmaksızın kullanıcı kaydı. */
    public Optional<DcUser> user(Long userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(usersById.get(userId));
    }

    /**
     * Kontratın silinmemiş her sorumlu kullanıcısı için bir attribution; hiç sorumlu yoksa tek
     * sentinel kayıt (left join).
     */
    public List<OrgAttribution> responsibleAttributions(String bookingContract) {
        List<Long> userIds = responsibleUsersByContract.get(bookingContract);
        if (userIds == null || userIds.isEmpty()) {
            return List.of(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
        }
        return userIds.stream()
                .map(attributionResolver::resolve)
                .toList();
    }
}
