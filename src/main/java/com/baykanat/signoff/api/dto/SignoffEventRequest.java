package com.baykanat.signoff.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** Attestation akışından gelen signoff event payload'u; Kafka'ya göndermeden önce doğrulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Signoff event payload for ingestion")
public class SignoffEventRequest {

    @NotBlank(message = "booking_contract is required")
    @JsonProperty("booking_contract")
    @Schema(description = "Booking contract the signoff is recorded against", example = "BC-100234")
    private String bookingContract;

    @NotNull(message = "dc_user_id is required")
    @Positive(message = "dc_user_id must be positive")
    @JsonProperty("dc_user_id")
    @Schema(description = "User who recorded the signoff", example = "4711")
    private Long dcUserId;

    @NotNull(message = "create_dtm is required")
    @JsonProperty("create_dtm")
    @Schema(description = "Signoff timestamp (ISO-8601 local date-time)", example = "2024-05-14T10:15:30")
    private LocalDateTime createDtm;

    @NotNull(message = "signoff_method_id is required")
    @JsonProperty("signoff_method_id")
    @Schema(description = "Signoff method id; the deferred method is excluded from latest-signoff ranking", example = "2")
    private Integer signoffMethodId;

    @NotNull(message = "sign_off_identity_id is required")
    @JsonProperty("sign_off_identity_id")
    @Schema(description = "Signoff identity id", example = "1")
    private Integer signOffIdentityId;

    @JsonProperty("defer_signoff_reason_id")
    @Schema(description = "Defer reason id", example = "0")
    private Integer deferSignoffReasonId;

    @JsonProperty("dc_engagement_id")
    @Schema(description = "Engagement header id", example = "9001")
    private Long dcEngagementId;

    @JsonProperty("signoff_event_id")
    @Schema(description = "Signoff event type id", example = "1")
    private Integer signoffEventId;

    @Size(max = 4000, message = "notes must be at most 4000 characters")
    @JsonProperty("notes")
    @Schema(description = "Free text notes", example = "Quarterly review with customer")
    private String notes;

    @JsonProperty("is_deleted")
    @Schema(description = "Soft-delete flag as recorded upstream", example = "false")
    private Boolean deleted;
}
