package com.example.dealdesk.domain;

import java.util.Map;

/**
 * Residual values published for one vehicle, as percentages of MSRP keyed by lease term.
 * A missing or zero percentage means the term is not offered for this vehicle.
 */
public record ResidualEntry(
        String brand,
        String modelName,
        String trim,
        String bodyStyle,
        Integer modelYear,
        Map<Integer, Double> residualPercentages
) {
    public ResidualEntry {
        residualPercentages = TermMaps.compact(residualPercentages);
    }

    public double residualPercent(int term) {
        Double pct = residualPercentages.get(term);
        return pct == null ? 0.0 : pct;
    }

    public boolean offersTerm(int term) {
        return residualPercent(term) != 0.0;
    }

    public String displayName() {
        return (brand + " " + modelName + " " + (trim == null ? "" : trim)).trim();
    }
}
