package com.example.dealdesk.domain;

// Flattened view of one evaluated (term, km, plan) combination for the analysis grid
public record LeaseGridRow(
        int term,
        int kmPerYear,
        LeasePlan option,
        @Cents double monthlyPayment,
        @Cents double preTaxMonthly,
        double rate,
        @Cents double leaseCash,
        double residualPercent,
        @Cents double residualValue,
        @Cents double totalCost,
        @Cents double costOfBorrowing
) {
    public static LeaseGridRow of(LeaseScenarioResult s) {
        return new LeaseGridRow(
                s.term(),
                s.kmPerYear(),
                s.plan(),
                s.monthlyPayment(),
                s.preTaxMonthly(),
                s.rate(),
                s.leaseCash(),
                s.residualPercent(),
                s.residualValue(),
                s.totalCost(),
                s.costOfBorrowing()
        );
    }
}
