package com.example.dealdesk.service;

import com.example.dealdesk.domain.PaymentFrequency;

/**
 * Fixed-rate loan payment mathematics.
 *
 * Biweekly and weekly payments are the monthly payment spread over 26 or 52 periods per
 * year, the way dealers quote them, not an amortization on a day-count basis.
 */
public final class AmortizationCalculator {

    private AmortizationCalculator() {}

    /**
     * Level monthly payment that repays {@code principal} over {@code months} at a nominal
     * annual rate expressed in percent (4.99 means 4.99%).
     *
     * @return 0 when there is nothing to finance or no term; principal / months at 0%
     */
    public static double monthlyPayment(double principal, double annualRatePct, int months) {
        if (principal <= 0 || months <= 0) return 0.0;
        if (annualRatePct == 0) return principal / months;
        double r = annualRatePct / 100 / 12;
        double growth = Math.pow(1 + r, months);
        return principal * r * growth / (growth - 1);
    }

    public static double toBiweekly(double monthly) {
        return monthly * 12 / 26;
    }

    public static double toWeekly(double monthly) {
        return monthly * 12 / 52;
    }

    public static double toFrequency(double monthly, PaymentFrequency frequency) {
        return frequency.fromMonthly(monthly);
    }
}
