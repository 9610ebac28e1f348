package com.example.dealdesk.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One priced lease: a single (term, mileage tier, plan) with its rate and lease cash.
 *
 * Amounts are held unrounded and written to JSON rounded to the cent. {@code netCapCost}
 * keeps its sign because the payment formulas use it as is; {@link #netCapCostForDisplay()}
 * is the floored value for presentation. {@code tradeInCreditLost} is the part of the
 * trade-in tax credit that exceeded the payment's taxes and could not be applied.
 */
public record LeaseScenarioResult(
        LeasePlan plan,
        int term,
        int kmPerYear,
        double rate,
        @Cents double leaseCash,
        @Cents double sellingPrice,
        @Cents double capCost,
        @Cents double carriedBalanceNet,
        @Cents double netCapCost,
        double residualPercent,
        @Cents double residualValue,
        double moneyFactor,
        @Cents double depreciation,
        @Cents double financeCharge,
        @Cents double preTaxMonthly,
        @Cents double preTaxBiweekly,
        @Cents double preTaxWeekly,
        @Cents double gst,
        @Cents double qst,
        @Cents double taxes,
        @Cents double tradeInCreditApplied,
        @Cents double tradeInCreditLost,
        @Cents double monthlyPayment,
        @Cents double biweeklyPayment,
        @Cents double weeklyPayment,
        @Cents double totalCost,
        @Cents double costOfBorrowing
) {
    @Cents
    @JsonProperty("net_cap_cost_for_display")
    public double netCapCostForDisplay() {
        return Math.max(0.0, netCapCost);
    }

    @JsonProperty("trade_in_credit_warning")
    public boolean hasTradeInCreditLoss() {
        return tradeInCreditLost > 0.0;
    }
}
