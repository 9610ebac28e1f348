package com.example.dealdesk.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two financing options a program can offer.
 * OPTION_1: rebates (consumer cash, bonus cash) with the option 1 rate.
 * OPTION_2: no rebates with the reduced option 2 rate.
 */
public enum FinancingChoice {
    OPTION_1("1"),
    OPTION_2("2");

    private final String code;

    FinancingChoice(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
