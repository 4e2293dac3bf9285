package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Kontrata atanmış sorumlu kullanıcı; event'i olmayan kontratların sahipliği buradan gelir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponsibleUser {

    private String bookingContract;
    private Long dcUserId;
    private boolean deleted;
}
