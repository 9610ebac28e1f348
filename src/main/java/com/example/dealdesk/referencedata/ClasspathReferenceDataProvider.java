package com.example.dealdesk.referencedata;

import com.example.dealdesk.config.DealDeskProperties;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.VehicleProgram;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the reference documents bundled on the classpath (locations under
 * {@code dealdesk.reference-data}). Documents use snake_case property names.
 *
 * A missing or malformed document is logged and treated as empty so that the service still
 * starts; financing and lease requests for the affected vehicles then degrade gracefully.
 */
@Slf4j
@Component
public class ClasspathReferenceDataProvider implements ReferenceDataProvider {

    private final DealDeskProperties.ReferenceData locations;
    private final ObjectMapper objectMapper;

    public ClasspathReferenceDataProvider(DealDeskProperties properties, ObjectMapper objectMapper) {
        this.locations = properties.getReferenceData();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<VehicleProgram> fetchPrograms() {
        List<VehicleProgram> programs = read(locations.getPrograms(), new TypeReference<List<VehicleProgram>>() {});
        return programs == null ? List.of() : programs;
    }

    @Override
    public ResidualDocument fetchResiduals() {
        ResidualDocument doc = read(locations.getResiduals(), new TypeReference<ResidualDocument>() {});
        return doc == null ? ResidualDocument.empty() : doc;
    }

    @Override
    public List<LeaseRateEntry> fetchLeaseRates() {
        LeaseRateDocument doc = read(locations.getLeaseRates(), new TypeReference<LeaseRateDocument>() {});
        return doc == null || doc.vehicles() == null ? List.of() : doc.vehicles();
    }

    private <T> T read(String resourcePath, TypeReference<T> type) {
        ClassPathResource res = new ClassPathResource(resourcePath);
        if (!res.exists()) {
            log.warn("Reference document {} not found on classpath", resourcePath);
            return null;
        }
        try (InputStream in = res.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            log.warn("Could not read reference document {}: {}", resourcePath, e.getMessage());
            return null;
        }
    }

    // Lease-rate document: {"vehicles": [...]}
    public record LeaseRateDocument(@JsonProperty("vehicles") List<LeaseRateEntry> vehicles) {}
}
