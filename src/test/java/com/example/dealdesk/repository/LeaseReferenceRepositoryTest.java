package com.example.dealdesk.repository;

import com.example.dealdesk.domain.KmAdjustmentTable;
import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.MileageTier;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.referencedata.ResidualDocument;
import com.example.dealdesk.referencedata.StaticReferenceDataProvider;
import com.example.dealdesk.repository.LeaseReferenceRepository.VehicleModelNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LeaseReferenceRepositoryTest {

    private static ResidualEntry residual(String brand, String model, String trim, String body, Integer year) {
        return new ResidualEntry(brand, model, trim, body, year, Map.of(36, 55.0));
    }

    private final LeaseReferenceRepository repository = new LeaseReferenceRepository(new StaticReferenceDataProvider(
            List.of(),
            new ResidualDocument(List.of(
                    residual("Ram", "1500", "Big Horn", "Crew Cab", 2025),
                    residual("Ram", "1500", "Big Horn", "Quad Cab", 2026),
                    residual("Ram", "1500", "Big Horn", "Crew Cab", 2026),
                    residual("Ram", "1500", "Sport", null, 2026),
                    residual("Jeep", "Compass", null, "4dr", null)), KmAdjustmentTable.empty()),
            List.of(new LeaseRateEntry("Ram", "1500", 2026, Map.of(36, 6.99), Map.of(), 0))));

    @Test
    void groupsVehiclesByBrandAndModel() {
        Map<String, Map<String, VehicleModelNode>> hierarchy = repository.vehicleHierarchy();

        assertThat(hierarchy).containsOnlyKeys("Jeep", "Ram");
        VehicleModelNode ram = hierarchy.get("Ram").get("1500");
        assertThat(ram.years()).containsExactly(2026, 2025);
        assertThat(ram.trims()).containsOnlyKeys("Big Horn", "Sport");
        assertThat(ram.trims().get("Big Horn")).containsExactly("Crew Cab", "Quad Cab");
        assertThat(ram.trims().get("Sport")).isEmpty();

        VehicleModelNode compass = hierarchy.get("Jeep").get("Compass");
        assertThat(compass.years()).isEmpty();
        assertThat(compass.trims()).containsOnlyKeys("");
    }

    @Test
    void matchesProgramsToReferenceRecords() {
        VehicleProgram ram = new VehicleProgram("ram", "Ram", "1500", "Big Horn", 2026, 0, 0, null, null);

        assertThat(repository.findResidual(ram, "Quad Cab")).map(ResidualEntry::bodyStyle).contains("Quad Cab");
        assertThat(repository.findLeaseRate(ram)).isPresent();
        assertThat(repository.kmAdjustments().adjustment(MileageTier.KM_12000, 36)).isZero();
    }
}
