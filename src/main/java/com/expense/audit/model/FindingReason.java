package com.expense.audit.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingReason {
    DUPLICATE("duplicate"),
    WEEKEND("weekend"),
    OVER_LIMIT("over_limit"),
    NEAR_LIMIT("near_limit"),
    SUSPICIOUS_KEYWORD("suspicious_keyword"),
    DISCREPANCY("discrepancy");

    private final String code;

    FindingReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
