package com.example.dealdesk.service;

import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.LeaseGridSearchResult;
import com.example.dealdesk.domain.LeasePlan;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.LeaseResult;
import com.example.dealdesk.domain.LeaseScenarioResult;
import com.example.dealdesk.domain.MileageTier;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.exception.InvalidDealException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lease pricing for a matched vehicle: the standard and alternative plans for the selected
 * term, and the grid search over all terms and mileage tiers.
 *
 * The two recommendations use different objectives and are exposed separately:
 * {@link LeaseResult#bestLease()} minimises total cost for the selected term, the grid search
 * minimises the monthly payment.
 */
@Slf4j
@Service
public class LeaseService {

    public Optional<LeaseResult> computeLease(ResidualEntry residual, LeaseRateEntry leaseRate, KmAdjustmentTable kmTable,
                                              DealInputs inputs, int term, int kmPerYear) {
        return computeLease(residual, leaseRate, kmTable, inputs, term, kmPerYear, inputs.effectiveBonusCash(0.0));
    }

    /**
     * @param bonusCash post-tax incentive resolved from the program and any override
     * @return empty when the vehicle does not offer the term
     */
    public Optional<LeaseResult> computeLease(ResidualEntry residual, LeaseRateEntry leaseRate, KmAdjustmentTable kmTable,
                                              DealInputs inputs, int term, int kmPerYear, double bonusCash) {
        requireLeaseTerm(term);
        MileageTier tier = MileageTier.fromKilometres(kmPerYear);
        if (!residual.offersTerm(term)) {
            log.debug("{} has no residual for {} months", residual.displayName(), term);
            return Optional.empty();
        }

        LeaseScenarioResult standard = scenario(residual, leaseRate, kmTable, inputs, bonusCash, term, tier, LeasePlan.STANDARD);
        LeaseScenarioResult alternative = scenario(residual, leaseRate, kmTable, inputs, bonusCash, term, tier, LeasePlan.ALTERNATIVE);

        LeasePlan best = null;
        Double savings = null;
        if (standard != null && alternative != null) {
            best = standard.totalCost() < alternative.totalCost() ? LeasePlan.STANDARD : LeasePlan.ALTERNATIVE;
            savings = Math.abs(standard.totalCost() - alternative.totalCost());
        }

        double residualPct = LeaseCalculator.adjustedResidualPercent(residual, kmTable, term, tier);
        return Optional.of(new LeaseResult(
                residual.displayName(),
                term,
                tier.getKilometresPerYear(),
                residual.residualPercent(term),
                kmTable.adjustment(tier, term),
                residualPct,
                inputs.msrpBasis() * residualPct / 100,
                inputs.msrpBasis(),
                standard,
                alternative,
                best,
                savings
        ));
    }

    public LeaseGridSearchResult searchBestLease(ResidualEntry residual, LeaseRateEntry leaseRate,
                                                 KmAdjustmentTable kmTable, DealInputs inputs) {
        return searchBestLease(residual, leaseRate, kmTable, inputs, inputs.effectiveBonusCash(0.0));
    }

    public LeaseGridSearchResult searchBestLease(ResidualEntry residual, LeaseRateEntry leaseRate,
                                                 KmAdjustmentTable kmTable, DealInputs inputs, double bonusCash) {
        LeaseGridSearchResult result = LeaseGridSearch.search(residual, leaseRate, kmTable, inputs, bonusCash);
        log.debug("Lease grid for {}: {} combinations priced", residual.displayName(), result.grid().size());
        return result;
    }

    private static LeaseScenarioResult scenario(ResidualEntry residual, LeaseRateEntry leaseRate, KmAdjustmentTable kmTable,
                                                DealInputs inputs, double bonusCash, int term, MileageTier tier,
                                                LeasePlan plan) {
        OptionalDouble rate = leaseRate.rateFor(plan, term);
        if (rate.isEmpty()) return null;
        return LeaseCalculator.calculate(residual, kmTable, inputs, bonusCash, term, tier, plan,
                rate.getAsDouble(), leaseRate.leaseCashFor(plan)).orElse(null);
    }

    private static void requireLeaseTerm(int term) {
        if (!LeaseCalculator.LEASE_TERMS.contains(term)) {
            throw new InvalidDealException("Unsupported lease term: " + term
                    + " months (expected one of " + LeaseCalculator.LEASE_TERMS + ")");
        }
    }
}
