package com.example.dealdesk.service;

import com.example.dealdesk.domain.BestLeaseOption;
import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.LeaseGridRow;
import com.example.dealdesk.domain.LeaseGridSearchResult;
import com.example.dealdesk.domain.LeasePlan;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.LeaseScenarioResult;
import com.example.dealdesk.domain.MileageTier;
import com.example.dealdesk.domain.ResidualEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Prices every mileage tier x lease term x plan combination and keeps the one with the lowest
 * monthly payment.
 *
 * Enumeration order is fixed: tiers from 12 000 to 24 000 km, terms ascending, and within a
 * term the alternative plan before the standard plan. On equal payments the first row wins.
 */
public final class LeaseGridSearch {

    private static final List<LeasePlan> PLAN_ORDER = List.of(LeasePlan.ALTERNATIVE, LeasePlan.STANDARD);

    private LeaseGridSearch() {}

    public static LeaseGridSearchResult search(ResidualEntry residual, LeaseRateEntry leaseRate,
                                               KmAdjustmentTable kmTable, DealInputs inputs, double bonusCash) {
        List<LeaseGridRow> grid = new ArrayList<>();
        LeaseScenarioResult best = null;

        for (MileageTier tier : MileageTier.values()) {
            for (int term : LeaseCalculator.LEASE_TERMS) {
                if (!residual.offersTerm(term)) continue;
                for (LeasePlan plan : PLAN_ORDER) {
                    OptionalDouble rate = leaseRate.rateFor(plan, term);
                    if (rate.isEmpty()) continue;
                    Optional<LeaseScenarioResult> scenario = LeaseCalculator.calculate(residual, kmTable, inputs,
                            bonusCash, term, tier, plan, rate.getAsDouble(), leaseRate.leaseCashFor(plan));
                    if (scenario.isEmpty()) continue;
                    LeaseScenarioResult s = scenario.get();
                    grid.add(LeaseGridRow.of(s));
                    if (best == null || s.monthlyPayment() < best.monthlyPayment()) {
                        best = s;
                    }
                }
            }
        }

        BestLeaseOption bestOption = best == null ? null
                : new BestLeaseOption(best.term(), best.kmPerYear(), best.plan(), best);
        return new LeaseGridSearchResult(bestOption, grid);
    }
}
