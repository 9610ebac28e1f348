package com.example.dealdesk.domain;

/**
 * Lease comparison for the selected term and mileage tier.
 *
 * Either scenario may be null when its plan has no rate for the term. {@code bestLease}
 * and {@code savings} compare total cost and are only set when both scenarios exist.
 */
public record LeaseResult(
        String vehicleName,
        int term,
        int kmPerYear,
        double baseResidualPercent,
        double kmAdjustment,
        double residualPercent,
        @Cents double residualValue,
        @Cents double pdsf,
        LeaseScenarioResult standard,
        LeaseScenarioResult alternative,
        LeasePlan bestLease,
        @Cents Double savings
) {
    public boolean hasScenario() {
        return standard != null || alternative != null;
    }
}
