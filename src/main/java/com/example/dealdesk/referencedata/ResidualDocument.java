package com.example.dealdesk.referencedata;

import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.ResidualEntry;

import java.util.List;

/**
 * Residual table as published: one entry per vehicle plus the km adjustment grid.
 * JSON shape: {@code {"vehicles": [...], "km_adjustments": {"adjustments": {"12000": {"36": 2}}}}}.
 */
public record ResidualDocument(List<ResidualEntry> vehicles, KmAdjustmentTable kmAdjustments) {

    public ResidualDocument {
        vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
        kmAdjustments = kmAdjustments == null ? KmAdjustmentTable.empty() : kmAdjustments;
    }

    public static ResidualDocument empty() {
        return new ResidualDocument(List.of(), KmAdjustmentTable.empty());
    }
}
