package com.example.dealdesk.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lease rate plans.
 * STANDARD: standard rate combined with the lease cash incentive.
 * ALTERNATIVE: alternative (usually lower) rate, no lease cash.
 */
public enum LeasePlan {
    STANDARD("standard"),
    ALTERNATIVE("alternative");

    private final String code;

    LeasePlan(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
