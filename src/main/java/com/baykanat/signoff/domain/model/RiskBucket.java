package com.baykanat.signoff.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** signoff_risk değerleri; etiketler sıralanabilir olacak şekilde a/b/c önekli. */
@Getter
@RequiredArgsConstructor
public enum RiskBucket {

    LOW("a_low_risk"),
    MEDIUM("b_med_risk"),
    HIGH("c_high_risk");

    private final String label;
}
