package com.baykanat.signoff.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** qualified_ibv değerleri. */
@Getter
@RequiredArgsConstructor
public enum QualificationStatus {

    SIGNED_OFF("Signed off"),
    DEFERRED_SIGNED_OFF("Deferred Signed off"),
    SIGN_OFF_OVERDUE("sign_off_overdue");

    private final String label;
}
