package com.example.dealdesk.api.dto;

import com.example.dealdesk.domain.LeaseGridRow;
import com.example.dealdesk.domain.BestLeaseOption;
import com.example.dealdesk.domain.LeaseResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public class DealDtos {
    // Accessory line as typed: the price is free text
    public record AccessoryLine(
            String description,
            String price
    ) {}

    // Deal form exactly as entered; every amount is free text and reads as zero when unparsable.
    // A fee left out of the payload (null) takes the configured default instead.
    public record DealForm(
            String vehiclePrice,
            List<AccessoryLine> accessories,
            String adminFee,
            String tireTax,
            String rdprmFee,
            String tradeInValue,
            String tradeInOwed,
            String downPayment,
            String bonusCash, // overrides the program's bonus cash when filled
            String frequency, // monthly, biweekly, weekly
            String pdsf,
            String carriedBalance, // negative = debt
            String dealerDiscount
    ) {}

    // Price both financing options of a program for one term
    public record FinancingRequest(
            @NotBlank String programId,
            @NotNull @Positive Integer term,
            @Valid DealForm deal
    ) {}

    // Price both financing options for every term
    public record ComparisonRequest(
            @NotBlank String programId,
            @Valid DealForm deal
    ) {}

    // Lease quote for the vehicle of a program; bodyStyle narrows residual matching when known
    public record LeaseRequest(
            @NotBlank String programId,
            @NotNull @Positive Integer term,
            @NotNull @Positive Integer kmPerYear,
            String bodyStyle,
            @Valid DealForm deal
    ) {}

    // lease is null when the vehicle has no residual or lease rate for the period or term
    public record LeaseQuoteResponse(
            LeaseResult lease,
            BestLeaseOption bestOption,
            List<LeaseGridRow> grid
    ) {}
}
