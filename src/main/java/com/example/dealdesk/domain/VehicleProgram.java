package com.example.dealdesk.domain;

/**
 * A manufacturer financing program for one vehicle (brand, model, optional trim, model year).
 *
 * Option 1 pairs the consumer cash rebate (pre-tax) and the bonus cash (post-tax) with
 * {@code option1Rates}. Option 2 gives up both rebates for {@code option2Rates}; when that table
 * is null the option does not exist for this vehicle.
 */
public record VehicleProgram(
        String id,
        String brand,
        String model,
        String trim,
        int year,
        double consumerCash,
        double bonusCash,
        RateTable option1Rates,
        RateTable option2Rates
) {
    public VehicleProgram {
        // a missing option 1 table quotes the fallback rate; option 2 stays null when not offered
        option1Rates = option1Rates == null ? RateTable.empty() : option1Rates;
    }

    public boolean hasOption2() {
        return option2Rates != null;
    }

    public String displayName() {
        String base = brand + " " + model;
        return trim == null || trim.isBlank() ? base : base + " " + trim;
    }
}
