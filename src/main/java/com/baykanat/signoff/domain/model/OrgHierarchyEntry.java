package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** organizational_hierarchy extract satırı; kullanıcıya FK ile değil string eşleşmesiyle bağlanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgHierarchyEntry {

    private String empCcoId;
    private String empCcoIdMasked;
    private String empName;
    private String level6WorkerName;
    private String level7WorkerName;
    private String level8WorkerName;
    private String level9WorkerName;
    private String mgrName;
    private String theater;
    private boolean deleted;
}
