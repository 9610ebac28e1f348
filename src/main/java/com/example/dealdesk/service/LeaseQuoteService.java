package com.example.dealdesk.service;

import com.example.dealdesk.api.dto.DealDtos.LeaseQuoteResponse;
import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.LeaseGridSearchResult;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.LeaseResult;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.exception.ResourceNotFoundException;
import com.example.dealdesk.repository.LeaseReferenceRepository;
import com.example.dealdesk.repository.ProgramRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a financing program to its lease reference records and prices the lease.
 *
 * A vehicle with no residual or lease-rate record is simply not leasable this period: the
 * response then carries no lease, no best option and an empty grid. When the vehicle is
 * leasable but neither plan is offered for the selected term, only the lease is left out.
 */
@Slf4j
@Service
public class LeaseQuoteService {
    private final ProgramRepository programRepository;
    private final LeaseReferenceRepository leaseReferenceRepository;
    private final LeaseService leaseService;

    public LeaseQuoteService(ProgramRepository programRepository,
                             LeaseReferenceRepository leaseReferenceRepository,
                             LeaseService leaseService) {
        this.programRepository = programRepository;
        this.leaseReferenceRepository = leaseReferenceRepository;
        this.leaseService = leaseService;
    }

    public LeaseQuoteResponse quote(String programId, DealInputs inputs, int term, int kmPerYear, String bodyStyle) {
        VehicleProgram program = programRepository.findById(programId)
                .orElseThrow(() -> new ResourceNotFoundException("Program not found: " + programId));

        Optional<ResidualEntry> residual = leaseReferenceRepository.findResidual(program, bodyStyle);
        Optional<LeaseRateEntry> leaseRate = leaseReferenceRepository.findLeaseRate(program);
        if (residual.isEmpty() || leaseRate.isEmpty()) {
            log.warn("No lease offered for {} (residual match: {}, lease-rate match: {})",
                    program.displayName(), residual.isPresent(), leaseRate.isPresent());
            return new LeaseQuoteResponse(null, null, List.of());
        }

        double bonusCash = inputs.effectiveBonusCash(program.bonusCash());
        LeaseResult lease = leaseService.computeLease(residual.get(), leaseRate.get(),
                leaseReferenceRepository.kmAdjustments(), inputs, term, kmPerYear, bonusCash)
                .filter(LeaseResult::hasScenario)
                .orElse(null);
        LeaseGridSearchResult search = leaseService.searchBestLease(residual.get(), leaseRate.get(),
                leaseReferenceRepository.kmAdjustments(), inputs, bonusCash);
        return new LeaseQuoteResponse(lease, search.best(), search.grid());
    }
}
