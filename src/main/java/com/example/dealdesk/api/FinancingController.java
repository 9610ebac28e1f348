package com.example.dealdesk.api;

import com.example.dealdesk.api.dto.DealDtos.ComparisonRequest;
import com.example.dealdesk.api.dto.DealDtos.FinancingRequest;
import com.example.dealdesk.domain.FinancingResult;
import com.example.dealdesk.domain.TermComparison;
import com.example.dealdesk.service.FinancingService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/financing")
public class FinancingController {
    private final FinancingService financingService;
    private final DealFormMapper dealFormMapper;

    public FinancingController(FinancingService financingService, DealFormMapper dealFormMapper) {
        this.financingService = financingService;
        this.dealFormMapper = dealFormMapper;
    }

    // Both options for the selected term, with the recommended one
    @PostMapping
    public FinancingResult compute(@Valid @RequestBody FinancingRequest request) {
        return financingService.computeFinancing(request.programId(), dealFormMapper.toInputs(request.deal()),
                request.term());
    }

    // One comparison row per financing term
    @PostMapping("/comparisons")
    public List<TermComparison> compareAllTerms(@Valid @RequestBody ComparisonRequest request) {
        return financingService.compareAllTerms(request.programId(), dealFormMapper.toInputs(request.deal()));
    }
}
