package com.example.dealdesk.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Residual percentage-point adjustments per mileage tier and lease term, relative to the
 * 24 000 km/year baseline. The baseline always adjusts by zero, whatever the table says.
 */
public record KmAdjustmentTable(@JsonProperty("adjustments") Map<Integer, Map<Integer, Double>> adjustments) {

    public KmAdjustmentTable {
        Map<Integer, Map<Integer, Double>> copy = new HashMap<>();
        if (adjustments != null) {
            adjustments.forEach((km, byTerm) -> {
                if (km != null) copy.put(km, TermMaps.compact(byTerm));
            });
        }
        adjustments = Map.copyOf(copy);
    }

    public static KmAdjustmentTable empty() {
        return new KmAdjustmentTable(Map.of());
    }

    public double adjustment(MileageTier tier, int term) {
        if (tier.isBaseline()) return 0.0;
        Double adj = adjustments.getOrDefault(tier.getKilometresPerYear(), Map.of()).get(term);
        return adj == null ? 0.0 : adj;
    }
}
