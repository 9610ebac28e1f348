package com.example.dealdesk.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot comparing both financing options for the selected term.
 *
 * {@code option2} is null when the program has no option 2; {@code bestOption} and
 * {@code savings} are then null as well. Savings are the absolute difference in term totals.
 */
public record FinancingResult(
        int term,
        PaymentFrequency frequency,
        FinancingOptionResult option1,
        FinancingOptionResult option2,
        FinancingChoice bestOption,
        @Cents Double savings,
        @Cents double taxableFees,
        @Cents double tradeInEquity,
        @Cents double downPayment,
        @Cents double bonusCash
) {
    // Payment at the selected frequency
    @Cents
    @JsonProperty("option1_payment")
    public double option1Payment() {
        return option1.paymentFor(frequency);
    }

    @Cents
    @JsonProperty("option2_payment")
    public Double option2Payment() {
        return option2 == null ? null : option2.paymentFor(frequency);
    }
}
