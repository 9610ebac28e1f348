package com.example.dealdesk.domain;

/**
 * One financing option priced for a single term.
 *
 * {@code principal} is the amount actually amortized (never negative); {@code netPrincipal}
 * is the unclamped value before that floor. {@code rebate} is the consumer cash deducted
 * before tax (zero for option 2).
 */
public record FinancingOptionResult(
        FinancingChoice option,
        double rate,
        @Cents double rebate,
        @Cents double taxableBase,
        @Cents double taxes,
        @Cents double grossPrincipal,
        @Cents double netPrincipal,
        @Cents double principal,
        @Cents double monthlyPayment,
        @Cents double biweeklyPayment,
        @Cents double weeklyPayment,
        @Cents double totalCost
) {
    public double paymentFor(PaymentFrequency frequency) {
        return switch (frequency) {
            case MONTHLY -> monthlyPayment;
            case BIWEEKLY -> biweeklyPayment;
            case WEEKLY -> weeklyPayment;
        };
    }
}
