package com.example.dealdesk.domain;

import com.example.dealdesk.exception.InvalidDealException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How often the customer pays.
 * BIWEEKLY and WEEKLY amounts are derived from the monthly amount assuming a year of
 * exactly 26 or 52 sub-periods; they are calendar approximations, not day-count exact.
 */
public enum PaymentFrequency {
    MONTHLY("monthly", 12),
    BIWEEKLY("biweekly", 26),
    WEEKLY("weekly", 52);

    private final String code;
    private final int periodsPerYear;

    PaymentFrequency(String code, int periodsPerYear) {
        this.code = code;
        this.periodsPerYear = periodsPerYear;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Converts a monthly amount to this frequency (monthly * 12 / periodsPerYear).
     */
    public double fromMonthly(double monthly) {
        return monthly * 12 / periodsPerYear;
    }

    /**
     * Resolves a frequency code. A missing code means monthly; an unknown one is a caller error.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PaymentFrequency fromCode(String code) {
        if (code == null || code.isBlank()) return MONTHLY;
        for (PaymentFrequency f : values()) {
            if (f.code.equalsIgnoreCase(code.trim()) || f.name().equalsIgnoreCase(code.trim())) {
                return f;
            }
        }
        throw new InvalidDealException("Unknown payment frequency: " + code);
    }
}
