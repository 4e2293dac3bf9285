package com.baykanat.signoff.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/** signoff_events satırı (JDBC, JPA değil). Append-only; sadece is_deleted ile soft-delete edilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignoffEvent {

    private Long id;
    private String bookingContract;
    private Long dcUserId;
    private LocalDateTime createDtm;
    private Integer signoffMethodId;
    private Integer signOffIdentityId;
    private Integer deferSignoffReasonId;
    private Long dcEngagementId;
    private Integer signoffEventId;
    private String notes;
    private boolean deleted;
    private String idempotencyKey;
    private Instant createdAt;
}
