package com.example.dealdesk.domain;

// One row of the all-terms comparison table; option 2 columns are null when the program has none
public record TermComparison(
        int termMonths,
        double option1Rate,
        @Cents double option1Monthly,
        @Cents double option1Total,
        @Cents double option1Rebate,
        Double option2Rate,
        @Cents Double option2Monthly,
        @Cents Double option2Total,
        FinancingChoice bestOption,
        @Cents Double savings
) {}
