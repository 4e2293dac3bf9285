package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.DcUser;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.OrgHierarchyEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * User id → hiyerarşi seviyeleri 6-9, yönetici, theater. Eşleşme
 * {@code emp_cco_id + "@" + domain == user.cco_id} ile yapılır; yalnızca silinmemiş kullanıcılar ve
 * masked id'si dolu, silinmemiş hiyerarşi kayıtları dikkate alınır. Eşleşme yoksa sentinel kayıt döner.
 */
@Slf4j
public class OrgAttributionResolver {

    private final Map<Long, OrgAttribution> byUserId;

    public OrgAttributionResolver(Collection<DcUser> users, Collection<OrgHierarchyEntry> hierarchy, String emailDomain) {
        Map<String, OrgHierarchyEntry> byKey = new HashMap<>();
        for (OrgHierarchyEntry entry : hierarchy) {
            if (entry.isDeleted() || entry.getEmpCcoIdMasked() == null || entry.getEmpCcoId() == null) {
                continue;
            }
            String key = entry.getEmpCcoId() + "@" + emailDomain;
            OrgHierarchyEntry previous = byKey.putIfAbsent(key, entry);
            if (previous != null) {
                log.warn("Multiple hierarchy entries for key {}, keeping masked id {}", key, previous.getEmpCcoIdMasked());
            }
        }

        this.byUserId = new HashMap<>();
        for (DcUser user : users) {
            if (user.isDeleted() || user.getUserId() == null || user.getCcoId() == null) {
                continue;
            }
            OrgHierarchyEntry entry = byKey.get(user.getCcoId());
            if (entry != null) {
                byUserId.putIfAbsent(user.getUserId(), toAttribution(entry));
            }
        }
        log.debug("Org attribution index built: {} of {} users matched a hierarchy entry", byUserId.size(), users.size());
    }

    /** Eşleşen kayıt; yoksa boş. */
    public Optional<OrgAttribution> find(Long userId) {
        return userId == null ? Optional.empty() : Optional.ofNullable(byUserId.get(userId));
    }

    /** Eşleşen kayıt veya tüm alanları "Not Assigned" olan sentinel. */
    public OrgAttribution resolve(Long userId) {
        return find(userId).orElse(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
    }

    private static OrgAttribution toAttribution(OrgHierarchyEntry entry) {
        return OrgAttribution.builder()
                .level6WorkerName(orNotAssigned(entry.getLevel6WorkerName()))
                .level7WorkerName(orNotAssigned(entry.getLevel7WorkerName()))
                .level8WorkerName(orNotAssigned(entry.getLevel8WorkerName()))
                .level9WorkerName(orNotAssigned(entry.getLevel9WorkerName()))
                .empCcoIdMasked(orNotAssigned(entry.getEmpCcoIdMasked()))
                .mgrName(orNotAssigned(entry.getMgrName()))
                .theater(orNotAssigned(entry.getTheater()))
                .build();
    }

    private static String orNotAssigned(String value) {
        return value == null || value.isEmpty() ? OrgAttribution.NOT_ASSIGNED : value;
    }
}
