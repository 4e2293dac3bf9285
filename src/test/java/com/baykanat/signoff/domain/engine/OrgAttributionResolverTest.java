package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.DcUser;
import com.baykanat.signoff.domain.model.OrgAttribution;
import com.baykanat.signoff.domain.model.OrgHierarchyEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.baykanat.signoff.domain.engine.ComplianceFixtures.EMAIL_DOMAIN;
import static com.baykanat.signoff.domain.engine.ComplianceFixtures.hierarchy;
import static com.baykanat.signoff.domain.engine.ComplianceFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

class OrgAttributionResolverTest {

    @Test
    @DisplayName("User matches hierarchy by cco id plus email domain; null levels become Not Assigned")
    void resolvesMatchedUser() {
        OrgAttributionResolver resolver = new OrgAttributionResolver(
                List.of(user(10, "jdoe@cisco.com")),
                List.of(hierarchy("jdoe", "M-0001", "Alice Manager")),
                EMAIL_DOMAIN);

        OrgAttribution attribution = resolver.resolve(10L);

        assertThat(attribution.getEmpCcoIdMasked()).isEqualTo("M-0001");
        assertThat(attribution.getMgrName()).isEqualTo("Alice Manager");
        assertThat(attribution.getLevel6WorkerName()).isEqualTo("L6 Alice Manager");
        assertThat(attribution.getLevel9WorkerName()).isEqualTo(OrgAttribution.NOT_ASSIGNED);
        assertThat(attribution.getTheater()).isEqualTo("Americas");
    }

    @Test
    @DisplayName("Unknown, deleted or unmatched users resolve to the Not Assigned sentinel")
    void unmatchedUsersGetSentinel() {
        DcUser deleted = user(11, "gone@cisco.com");
        deleted.setDeleted(true);
        OrgHierarchyEntry unmasked = hierarchy("nomask", null, "Bob");

        OrgAttributionResolver resolver = new OrgAttributionResolver(
                List.of(deleted, user(12, "nomask@cisco.com"), user(13, "other@example.com")),
                List.of(hierarchy("gone", "M-0002", "Carol"), unmasked, hierarchy("other", "M-0003", "Dan")),
                EMAIL_DOMAIN);

        assertThat(resolver.resolve(11L)).isEqualTo(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
        assertThat(resolver.resolve(12L)).isEqualTo(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
        assertThat(resolver.resolve(13L)).isEqualTo(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
        assertThat(resolver.resolve(99L)).isEqualTo(OrgAttribution.NOT_ASSIGNED_ATTRIBUTION);
        assertThat(resolver.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Duplicate hierarchy keys keep the first entry")
    void duplicateHierarchyKeysKeepFirst() {
        OrgAttributionResolver resolver = new OrgAttributionResolver(
                List.of(user(10, "jdoe@cisco.com")),
                List.of(hierarchy("jdoe", "M-0001", "First"), hierarchy("jdoe", "M-0009", "Second")),
                EMAIL_DOMAIN);

        assertThat(resolver.resolve(10L).getMgrName()).isEqualTo("First");
    }
}
