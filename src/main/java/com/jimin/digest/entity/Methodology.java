package com.jimin.digest.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 근거 유형(방법론) - 닫힌 열거형
 * 분류 불가 시 NA (null 금지)
 */
public enum Methodology {

    RCT("RCT"),
    COHORT("Cohort"),
    CASE("Case"),
    REVIEW("Review"),
    META("Meta"),
    PREPRINT("Preprint"),
    NA("NA");

    private final String label;

    Methodology(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
