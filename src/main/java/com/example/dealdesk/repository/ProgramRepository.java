package com.example.dealdesk.repository;

import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.referencedata.ReferenceDataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Repository
public class ProgramRepository {
    // Programs keyed by id, populated once at start-up in publication order
    private final Map<String, VehicleProgram> programsById = new LinkedHashMap<>();

    public ProgramRepository(ReferenceDataProvider provider) {
        for (VehicleProgram p : provider.fetchPrograms()) {
            if (p.id() == null || p.id().isBlank()) {
                log.warn("Skipping program without id: {}", p.displayName());
                continue;
            }
            programsById.put(p.id(), p);
        }
        log.info("Loaded {} financing programs", programsById.size());
    }

    public Optional<VehicleProgram> findById(String id) {
        return Optional.ofNullable(id == null ? null : programsById.get(id));
    }

    // All programs in a stable iteration order
    public List<VehicleProgram> findAll() {
        return new ArrayList<>(programsById.values());
    }

    /**
     * Programs filtered by model year and brand (either may be null), sorted by "model trim".
     */
    public List<VehicleProgram> find(Integer year, String brand) {
        return programsById.values().stream()
                .filter(p -> year == null || p.year() == year)
                .filter(p -> brand == null || brand.isBlank() || p.brand().equalsIgnoreCase(brand))
                .sorted(Comparator.comparing(ProgramRepository::sortKey))
                .toList();
    }

    private static String sortKey(VehicleProgram p) {
        return (p.model() + " " + (p.trim() == null ? "" : p.trim())).trim().toLowerCase(Locale.ROOT);
    }
}
