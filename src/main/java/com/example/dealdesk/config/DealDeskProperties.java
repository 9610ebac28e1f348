package com.example.dealdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code dealdesk} prefix.
 */
@Data
@ConfigurationProperties(prefix = "dealdesk")
public class DealDeskProperties {

    private ReferenceData referenceData = new ReferenceData();
    private DefaultFees defaultFees = new DefaultFees();

    // Classpath locations of the reference documents loaded at start-up
    @Data
    public static class ReferenceData {
        private String programs = "data/programs.json";
        private String residuals = "data/residuals.json";
        private String leaseRates = "data/lease-rates.json";
    }

    // Delivery fees applied when a request leaves the field out
    @Data
    public static class DefaultFees {
        private double adminFee = 259.95;
        private double tireTax = 15.0;
        private double rdprmFee = 100.0;
    }
}
