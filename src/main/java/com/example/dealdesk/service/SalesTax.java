package com.example.dealdesk.service;

/**
 * Quebec sales taxes applied to vehicle sales and lease payments.
 * GST (federal) and QST (provincial) are kept separate so that itemized amounts always add up
 * to the combined rate used in single-multiplier calculations.
 */
public final class SalesTax {
    public static final double GST_RATE = 0.05;
    public static final double QST_RATE = 0.09975;
    public static final double COMBINED_RATE = GST_RATE + QST_RATE; // 14.975%

    private SalesTax() {}

    public static double gst(double base) {
        return base * GST_RATE;
    }

    public static double qst(double base) {
        return base * QST_RATE;
    }

    public static double combined(double base) {
        return base * COMBINED_RATE;
    }

    // TODO: take the rate from configuration once programs outside Quebec are loaded
    public static double grossUp(double amount) {
        return amount * (1 + COMBINED_RATE);
    }
}
