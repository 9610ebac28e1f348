package com.example.dealdesk.repository;

import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.referencedata.ReferenceDataProvider;
import com.example.dealdesk.referencedata.ResidualDocument;
import com.example.dealdesk.service.VehicleMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Residual and lease-rate tables for the current period, held in memory.
 */
@Slf4j
@Repository
public class LeaseReferenceRepository {

    private final List<ResidualEntry> residuals;
    private final KmAdjustmentTable kmAdjustments;
    private final List<LeaseRateEntry> leaseRates;

    public LeaseReferenceRepository(ReferenceDataProvider provider) {
        ResidualDocument doc = provider.fetchResiduals();
        this.residuals = doc.vehicles();
        this.kmAdjustments = doc.kmAdjustments();
        this.leaseRates = List.copyOf(provider.fetchLeaseRates());
        log.info("Loaded {} residual entries and {} lease-rate entries", residuals.size(), leaseRates.size());
    }

    public List<ResidualEntry> residuals() {
        return residuals;
    }

    public KmAdjustmentTable kmAdjustments() {
        return kmAdjustments;
    }

    public List<LeaseRateEntry> leaseRates() {
        return leaseRates;
    }

    public Optional<ResidualEntry> findResidual(VehicleProgram program, String bodyStyle) {
        return VehicleMatcher.matchResidual(program, residuals, bodyStyle);
    }

    public Optional<LeaseRateEntry> findLeaseRate(VehicleProgram program) {
        return VehicleMatcher.matchLeaseRate(program, leaseRates);
    }

    /**
     * Residual vehicles grouped brand, then model, listing model years (newest first) and the
     * body styles published for each trim.
     */
    public Map<String, Map<String, VehicleModelNode>> vehicleHierarchy() {
        Map<String, Map<String, TreeSet<Integer>>> years = new TreeMap<>();
        Map<String, Map<String, Map<String, List<String>>>> trims = new TreeMap<>();
        for (ResidualEntry e : residuals) {
            String trim = e.trim() == null ? "" : e.trim();
            years.computeIfAbsent(e.brand(), b -> new TreeMap<>())
                    .computeIfAbsent(e.modelName(), m -> new TreeSet<>(Comparator.reverseOrder()));
            if (e.modelYear() != null) {
                years.get(e.brand()).get(e.modelName()).add(e.modelYear());
            }
            List<String> bodies = trims.computeIfAbsent(e.brand(), b -> new TreeMap<>())
                    .computeIfAbsent(e.modelName(), m -> new LinkedHashMap<>())
                    .computeIfAbsent(trim, t -> new ArrayList<>());
            String body = e.bodyStyle();
            if (body != null && !body.isBlank() && !bodies.contains(body)) {
                bodies.add(body);
            }
        }

        Map<String, Map<String, VehicleModelNode>> result = new TreeMap<>();
        years.forEach((brand, models) -> models.forEach((model, ys) -> result
                .computeIfAbsent(brand, b -> new TreeMap<>())
                .put(model, new VehicleModelNode(List.copyOf(ys), trims.get(brand).get(model)))));
        return result;
    }

    // Years newest first; trims map to the body styles published for them
    public record VehicleModelNode(List<Integer> years, Map<String, List<String>> trims) {}
}
