package com.example.dealdesk.domain;

/**
 * The grid combination with the lowest monthly payment. This optimises periodic
 * affordability and can differ from {@link LeaseResult#bestLease()}, which compares total cost.
 */
public record BestLeaseOption(
        int term,
        int kmPerYear,
        LeasePlan option,
        LeaseScenarioResult scenario
) {}
