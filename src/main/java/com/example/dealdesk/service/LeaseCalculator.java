package com.example.dealdesk.service;

import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.LeasePlan;
import com.example.dealdesk.domain.LeaseScenarioResult;
import com.example.dealdesk.domain.MileageTier;
import com.example.dealdesk.domain.ResidualEntry;

import java.util.List;
import java.util.Optional;

/**
 * Prices a single lease scenario the way Quebec lessors quote it.
 *
 * Sales tax is charged on each payment rather than capitalized. Tire tax and the RDPRM fee are
 * paid at delivery and stay out of the capitalized cost; only the admin fee is capitalized.
 * The trade-in tax credit is spread over the term and can never exceed the taxes of a payment.
 */
public final class LeaseCalculator {
    /** Lease terms, in months, residual tables are published for. */
    public static final List<Integer> LEASE_TERMS = List.of(24, 27, 36, 39, 42, 48, 51, 54, 60);

    // Converts an annual percentage rate into a per-month money factor
    private static final double MONEY_FACTOR_DIVISOR = 2400.0;

    private LeaseCalculator() {}

    /**
     * Trade-in sales tax credit for one payment.
     *
     * @param potential credit earned per payment, (trade-in value / term) x combined tax rate
     * @param applied   part of the potential used against the payment's taxes
     * @param lost      part that exceeded the taxes; reported, never silently dropped
     */
    public record TradeInTaxCredit(double potential, double applied, double lost) {
        public static final TradeInTaxCredit NONE = new TradeInTaxCredit(0, 0, 0);

        public static TradeInTaxCredit of(double tradeInValue, int term, double paymentTaxes) {
            if (tradeInValue <= 0) return NONE;
            double potential = SalesTax.combined(tradeInValue / term);
            double applied = Math.max(0.0, Math.min(potential, paymentTaxes));
            double lost = potential - applied;
            return new TradeInTaxCredit(potential, applied, lost);
        }
    }

    /**
     * Monthly lease payment built from the net capitalized cost and the residual value.
     */
    public record LeasePayment(
            double moneyFactor,
            double depreciation,
            double financeCharge,
            double preTax,
            double gst,
            double qst,
            double taxes,
            TradeInTaxCredit tradeInCredit,
            double postTax
    ) {}

    public static double adjustedResidualPercent(ResidualEntry residual, KmAdjustmentTable kmTable,
                                                 int term, MileageTier tier) {
        return residual.residualPercent(term) + kmTable.adjustment(tier, term);
    }

    /**
     * A carried debt is grossed up by the sales tax; a carried credit rolls in unchanged.
     */
    public static double carriedBalanceNet(double carriedBalance) {
        if (carriedBalance < 0) return SalesTax.grossUp(Math.abs(carriedBalance));
        if (carriedBalance > 0) return carriedBalance;
        return 0.0;
    }

    public static double moneyFactor(double rate) {
        return rate / MONEY_FACTOR_DIVISOR;
    }

    public static LeasePayment payment(double netCapCost, double residualValue, int term, double rate,
                                       double tradeInValue) {
        double moneyFactor = moneyFactor(rate);
        double depreciation = (netCapCost - residualValue) / term;
        double financeCharge = (netCapCost + residualValue) * moneyFactor;
        double preTax = depreciation + financeCharge;
        double gst = SalesTax.gst(preTax);
        double qst = SalesTax.qst(preTax);
        double taxes = gst + qst;
        TradeInTaxCredit credit = TradeInTaxCredit.of(tradeInValue, term, taxes);
        double postTax = Math.max(0.0, preTax + taxes - credit.applied());
        return new LeasePayment(moneyFactor, depreciation, financeCharge, preTax, gst, qst, taxes, credit, postTax);
    }

    /**
     * Prices one plan for one term and mileage tier.
     *
     * @param bonusCash post-tax incentive already resolved against any salesperson override
     * @return empty when the vehicle has no residual for the term, i.e. the term is not offered
     */
    public static Optional<LeaseScenarioResult> calculate(ResidualEntry residual, KmAdjustmentTable kmTable,
                                                          DealInputs inputs, double bonusCash, int term,
                                                          MileageTier tier, LeasePlan plan, double rate,
                                                          double leaseCash) {
        if (!residual.offersTerm(term)) return Optional.empty();

        double residualPct = adjustedResidualPercent(residual, kmTable, term, tier);
        double residualValue = inputs.msrpBasis() * residualPct / 100;

        double sellingPrice = inputs.vehiclePrice() + inputs.accessoriesTotal() - inputs.dealerDiscount();
        double capCost = sellingPrice + inputs.adminFee() - leaseCash;
        double carried = carriedBalanceNet(inputs.carriedBalance());
        double netCapCost = capCost + carried + inputs.tradeInOwed() - inputs.tradeInValue()
                - inputs.downPayment() - bonusCash;

        LeasePayment p = payment(netCapCost, residualValue, term, rate, inputs.tradeInValue());

        return Optional.of(new LeaseScenarioResult(
                plan,
                term,
                tier.getKilometresPerYear(),
                rate,
                leaseCash,
                sellingPrice,
                capCost,
                carried,
                netCapCost,
                residualPct,
                residualValue,
                p.moneyFactor(),
                p.depreciation(),
                p.financeCharge(),
                p.preTax(),
                AmortizationCalculator.toBiweekly(p.preTax()),
                AmortizationCalculator.toWeekly(p.preTax()),
                p.gst(),
                p.qst(),
                p.taxes(),
                p.tradeInCredit().applied(),
                p.tradeInCredit().lost(),
                p.postTax(),
                AmortizationCalculator.toBiweekly(p.postTax()),
                AmortizationCalculator.toWeekly(p.postTax()),
                p.postTax() * term,
                p.financeCharge() * term
        ));
    }
}
