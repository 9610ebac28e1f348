package com.example.dealdesk.domain;

import lombok.Builder;

import java.util.List;

/**
 * Deal-specific amounts entered by the salesperson, already parsed to numbers.
 *
 * Amounts are in dollars. {@code downPayment} is tax-inclusive. {@code bonusCashOverride} is null
 * when the salesperson did not override the program's bonus cash. {@code pdsf},
 * {@code carriedBalance} and {@code dealerDiscount} are used by lease calculations only; a
 * {@code pdsf} of zero means "use the vehicle price" and a negative carried balance is a debt.
 */
@Builder(toBuilder = true)
public record DealInputs(
        double vehiclePrice,
        List<AccessoryItem> accessories,
        double adminFee,
        double tireTax,
        double rdprmFee,
        double tradeInValue,
        double tradeInOwed,
        double downPayment,
        Double bonusCashOverride,
        PaymentFrequency frequency,
        double pdsf,
        double carriedBalance,
        double dealerDiscount
) {
    public DealInputs {
        accessories = accessories == null ? List.of() : List.copyOf(accessories);
        frequency = frequency == null ? PaymentFrequency.MONTHLY : frequency;
    }

    public double accessoriesTotal() {
        return accessories.stream().mapToDouble(AccessoryItem::price).sum();
    }

    // admin fee + tire tax + RDPRM, all taxable
    public double taxableFees() {
        return adminFee + tireTax + rdprmFee;
    }

    public double tradeInEquity() {
        return tradeInValue - tradeInOwed;
    }

    /** @return the override when one was entered, else the program's bonus cash */
    public double effectiveBonusCash(double programBonusCash) {
        return bonusCashOverride != null ? bonusCashOverride : programBonusCash;
    }

    /** @return the MSRP basis for residual values */
    public double msrpBasis() {
        return pdsf > 0 ? pdsf : vehiclePrice;
    }
}
