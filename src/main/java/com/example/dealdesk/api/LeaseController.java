package com.example.dealdesk.api;

import com.example.dealdesk.api.dto.DealDtos.LeaseQuoteResponse;
import com.example.dealdesk.api.dto.DealDtos.LeaseRequest;
import com.example.dealdesk.repository.LeaseReferenceRepository;
import com.example.dealdesk.repository.LeaseReferenceRepository.VehicleModelNode;
import com.example.dealdesk.service.LeaseQuoteService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/leases")
public class LeaseController {
    private final LeaseQuoteService leaseQuoteService;
    private final LeaseReferenceRepository leaseReferenceRepository;
    private final DealFormMapper dealFormMapper;

    public LeaseController(LeaseQuoteService leaseQuoteService,
                           LeaseReferenceRepository leaseReferenceRepository,
                           DealFormMapper dealFormMapper) {
        this.leaseQuoteService = leaseQuoteService;
        this.leaseReferenceRepository = leaseReferenceRepository;
        this.dealFormMapper = dealFormMapper;
    }

    // Selected-term comparison plus the cheapest-payment search over every term and mileage tier
    @PostMapping
    public LeaseQuoteResponse quote(@Valid @RequestBody LeaseRequest request) {
        return leaseQuoteService.quote(request.programId(), dealFormMapper.toInputs(request.deal()),
                request.term(), request.kmPerYear(), request.bodyStyle());
    }

    // brand -> model -> years and trims with their body styles
    @GetMapping("/vehicles")
    public Map<String, Map<String, VehicleModelNode>> vehicles() {
        return leaseReferenceRepository.vehicleHierarchy();
    }
}
