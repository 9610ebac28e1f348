package com.example.dealdesk.domain;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Lease rates for one vehicle. The standard plan is paired with {@code leaseCash}; the
 * alternative plan never is. {@code model} may embed trim names (e.g. "Grand Cherokee Laredo, Altitude").
 */
public record LeaseRateEntry(
        String brand,
        String model,
        Integer modelYear,
        Map<Integer, Double> standardRates,
        Map<Integer, Double> alternativeRates,
        double leaseCash
) {
    public LeaseRateEntry {
        standardRates = TermMaps.compact(standardRates);
        alternativeRates = TermMaps.compact(alternativeRates);
    }

    public OptionalDouble rateFor(LeasePlan plan, int term) {
        Double rate = (plan == LeasePlan.STANDARD ? standardRates : alternativeRates).get(term);
        return rate == null ? OptionalDouble.empty() : OptionalDouble.of(rate);
    }

    public double leaseCashFor(LeasePlan plan) {
        return plan == LeasePlan.STANDARD ? leaseCash : 0.0;
    }
}
