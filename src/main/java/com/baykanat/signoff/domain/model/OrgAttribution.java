package com.baykanat.signoff.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/** Kullanıcının hiyerarşi seviyeleri 6-9, yöneticisi ve theater'ı. Hiçbir alan null olmaz. */
@Value
@Builder
public class OrgAttribution {

    public static final String NOT_ASSIGNED = "Not Assigned";

    /** Eşleşme olmadığında kullanılan hazır kayıt; tüm alanlar birlikte set edilir. */
    public static final OrgAttribution NOT_ASSIGNED_ATTRIBUTION = OrgAttribution.builder()
            .level6WorkerName(NOT_ASSIGNED)
            .level7WorkerName(NOT_ASSIGNED)
            .level8WorkerName(NOT_ASSIGNED)
            .level9WorkerName(NOT_ASSIGNED)
            .empCcoIdMasked(NOT_ASSIGNED)
            .mgrName(NOT_ASSIGNED)
            .theater(NOT_ASSIGNED)
            .build();

    @JsonProperty("level6_worker_name")
    String level6WorkerName;

    @JsonProperty("level7_worker_name")
    String level7WorkerName;

    @JsonProperty("level8_worker_name")
    String level8WorkerName;

    @JsonProperty("level9_worker_name")
    String level9WorkerName;

    @JsonProperty("emp_cco_id_masked")
    String empCcoIdMasked;

    @JsonProperty("mgr_name")
    String mgrName;

    @JsonProperty("theater")
    String theater;
}
