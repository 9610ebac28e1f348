package com.example.dealdesk.domain;

import com.example.dealdesk.exception.InvalidDealException;

/**
 * Yearly mileage allowances a lease can be written for. Residual percentages are published
 * for the 24 000 km baseline; the other tiers carry a per-term adjustment.
 */
public enum MileageTier {
    KM_12000(12000),
    KM_18000(18000),
    KM_24000(24000);

    public static final MileageTier BASELINE = KM_24000;

    private final int kilometresPerYear;

    MileageTier(int kilometresPerYear) {
        this.kilometresPerYear = kilometresPerYear;
    }

    public int getKilometresPerYear() {
        return kilometresPerYear;
    }

    public boolean isBaseline() {
        return this == BASELINE;
    }

    public static MileageTier fromKilometres(int kilometresPerYear) {
        for (MileageTier tier : values()) {
            if (tier.kilometresPerYear == kilometresPerYear) return tier;
        }
        throw new InvalidDealException("Unsupported mileage tier: " + kilometresPerYear + " km/year");
    }
}
