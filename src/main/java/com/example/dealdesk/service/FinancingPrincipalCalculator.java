package com.example.dealdesk.service;

import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.VehicleProgram;

/**
 * Derives the taxable base and the amount financed for each financing option.
 *
 * Consumer cash is a pre-tax rebate and lowers the taxable base. Down payment and bonus cash
 * are tax-inclusive amounts taken off after tax has been computed.
 */
public final class FinancingPrincipalCalculator {

    private FinancingPrincipalCalculator() {}

    /**
     * Amounts leading from the selling price to the principal.
     *
     * @param taxableBase    amount the sales tax applies to
     * @param taxes          combined GST + QST on the base
     * @param grossPrincipal base + taxes + amount still owed on the trade-in
     * @param netPrincipal   gross principal less post-tax deductions, may be negative
     */
    public record FinancedAmount(double taxableBase, double taxes, double grossPrincipal, double netPrincipal) {

        /** @return the amount to amortize; a deal fully covered by rebates finances nothing */
        public double principal() {
            return Math.max(0.0, netPrincipal);
        }
    }

    /**
     * Option 1: price less consumer cash, post-tax deduction of down payment and bonus cash.
     */
    public static FinancedAmount option1(VehicleProgram program, DealInputs inputs) {
        double base = inputs.vehiclePrice() + inputs.accessoriesTotal()
                - program.consumerCash()
                - inputs.tradeInValue()
                + inputs.taxableFees();
        double taxes = SalesTax.combined(base);
        double gross = base + taxes + inputs.tradeInOwed();
        double net = gross - inputs.downPayment() - inputs.effectiveBonusCash(program.bonusCash());
        return new FinancedAmount(base, taxes, gross, net);
    }

    /**
     * Option 2: full price, only the down payment comes off after tax.
     */
    public static FinancedAmount option2(DealInputs inputs) {
        double base = inputs.vehiclePrice() + inputs.accessoriesTotal()
                - inputs.tradeInValue()
                + inputs.taxableFees();
        double taxes = SalesTax.combined(base);
        double gross = base + taxes + inputs.tradeInOwed();
        double net = gross - inputs.downPayment();
        return new FinancedAmount(base, taxes, gross, net);
    }
}
