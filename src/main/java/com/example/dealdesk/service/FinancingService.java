package com.example.dealdesk.service;

import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.FinancingChoice;
import com.example.dealdesk.domain.FinancingOptionResult;
import com.example.dealdesk.domain.FinancingResult;
import com.example.dealdesk.domain.RateTable;
import com.example.dealdesk.domain.TermComparison;
import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.exception.InvalidDealException;
import com.example.dealdesk.exception.ResourceNotFoundException;
import com.example.dealdesk.repository.ProgramRepository;
import com.example.dealdesk.service.FinancingPrincipalCalculator.FinancedAmount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Prices both financing options of a program and recommends the cheaper one.
 *
 * Results are fresh snapshots computed from the arguments only; callers re-run the whole
 * computation whenever an input changes.
 */
@Slf4j
@Service
public class FinancingService {
    // Read-only access to the programs loaded at start-up
    private final ProgramRepository programRepository;

    public FinancingService(ProgramRepository programRepository) {
        this.programRepository = programRepository;
    }

    public FinancingResult computeFinancing(String programId, DealInputs inputs, int term) {
        return computeFinancing(findProgram(programId), inputs, term);
    }

    public List<TermComparison> compareAllTerms(String programId, DealInputs inputs) {
        return compareAllTerms(findProgram(programId), inputs);
    }

    public FinancingResult computeFinancing(VehicleProgram program, DealInputs inputs, int term) {
        requireSupportedTerm(term);
        log.debug("Pricing financing for {} over {} months", program.displayName(), term);

        FinancingOptionResult option1 = priceOption(FinancingChoice.OPTION_1, program.option1Rates(),
                FinancingPrincipalCalculator.option1(program, inputs), program.consumerCash(), term);

        FinancingOptionResult option2 = null;
        FinancingChoice best = null;
        Double savings = null;
        if (program.hasOption2()) {
            option2 = priceOption(FinancingChoice.OPTION_2, program.option2Rates(),
                    FinancingPrincipalCalculator.option2(inputs), 0.0, term);
            // Option 1 carries the rebate, so it keeps an exact tie
            if (option2.totalCost() < option1.totalCost()) {
                best = FinancingChoice.OPTION_2;
            } else {
                best = FinancingChoice.OPTION_1;
            }
            savings = Math.abs(option1.totalCost() - option2.totalCost());
        }

        return new FinancingResult(
                term,
                inputs.frequency(),
                option1,
                option2,
                best,
                savings,
                inputs.taxableFees(),
                inputs.tradeInEquity(),
                inputs.downPayment(),
                inputs.effectiveBonusCash(program.bonusCash())
        );
    }

    /**
     * Runs the option comparison for every term a program can quote, shortest term first.
     */
    public List<TermComparison> compareAllTerms(VehicleProgram program, DealInputs inputs) {
        List<TermComparison> rows = new ArrayList<>(RateTable.SUPPORTED_TERMS.size());
        for (int term : RateTable.SUPPORTED_TERMS) {
            FinancingResult r = computeFinancing(program, inputs, term);
            FinancingOptionResult o1 = r.option1();
            FinancingOptionResult o2 = r.option2();
            rows.add(new TermComparison(
                    term,
                    o1.rate(),
                    o1.monthlyPayment(),
                    o1.totalCost(),
                    o1.rebate(),
                    o2 != null ? o2.rate() : null,
                    o2 != null ? o2.monthlyPayment() : null,
                    o2 != null ? o2.totalCost() : null,
                    r.bestOption(),
                    r.savings()
            ));
        }
        return rows;
    }

    private static FinancingOptionResult priceOption(FinancingChoice option, RateTable rates, FinancedAmount amount,
                                                     double rebate, int term) {
        double rate = RateTableResolver.resolve(rates, term);
        double monthly = AmortizationCalculator.monthlyPayment(amount.principal(), rate, term);
        return new FinancingOptionResult(
                option,
                rate,
                rebate,
                amount.taxableBase(),
                amount.taxes(),
                amount.grossPrincipal(),
                amount.netPrincipal(),
                amount.principal(),
                monthly,
                AmortizationCalculator.toBiweekly(monthly),
                AmortizationCalculator.toWeekly(monthly),
                monthly * term
        );
    }

    private VehicleProgram findProgram(String programId) {
        return programRepository.findById(programId)
                .orElseThrow(() -> new ResourceNotFoundException("Program not found: " + programId));
    }

    private static void requireSupportedTerm(int term) {
        if (!RateTable.SUPPORTED_TERMS.contains(term)) {
            throw new InvalidDealException("Unsupported financing term: " + term
                    + " months (expected one of " + RateTable.SUPPORTED_TERMS + ")");
        }
    }
}
