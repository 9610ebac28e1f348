package com.example.dealdesk.referencedata;

import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.VehicleProgram;

import java.util.List;

/**
 * Abstraction for the component that supplies financing programs, residual tables and lease
 * rates for the current program period.
 */
public interface ReferenceDataProvider {
    /**
     * Financing programs in publication order. Implementations return an empty list rather
     * than failing when the source is unavailable.
     */
    List<VehicleProgram> fetchPrograms();

    /**
     * Residual entries and km adjustments. An unavailable source yields an empty document.
     */
    ResidualDocument fetchResiduals();

    /**
     * Lease rates and lease cash per vehicle, empty when unavailable.
     */
    List<LeaseRateEntry> fetchLeaseRates();
}
