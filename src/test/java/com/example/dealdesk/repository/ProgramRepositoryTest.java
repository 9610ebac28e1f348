package com.example.dealdesk.repository;

import com.example.dealdesk.domain.RateTable;
import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.referencedata.StaticReferenceDataProvider;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProgramRepositoryTest {

    private static final RateTable RATES = RateTable.of(Map.of(60, 4.99));

    private static VehicleProgram program(String id, String brand, String model, String trim, int year) {
        return new VehicleProgram(id, brand, model, trim, year, 0, 0, RATES, null);
    }

    private final ProgramRepository repository = new ProgramRepository(StaticReferenceDataProvider.ofPrograms(
            program("wrangler", "Jeep", "Wrangler", "Sahara", 2026),
            program("cherokee", "Jeep", "Grand Cherokee", "Laredo", 2026),
            program("compass-25", "Jeep", "Compass", null, 2025),
            program("ram", "Ram", "1500", "Big Horn", 2026),
            program(null, "Ram", "2500", null, 2026),
            program(" ", "Ram", "3500", null, 2026)));

    @Test
    void skipsProgramsWithoutId() {
        assertThat(repository.findAll()).extracting(VehicleProgram::id)
                .containsExactly("wrangler", "cherokee", "compass-25", "ram");
    }

    @Test
    void findsById() {
        assertThat(repository.findById("ram")).map(VehicleProgram::model).contains("1500");
        assertThat(repository.findById("missing")).isEmpty();
        assertThat(repository.findById(null)).isEmpty();
    }

    @Test
    void filtersByYearAndBrandSortedByModelAndTrim() {
        assertThat(repository.find(2026, "jeep")).extracting(VehicleProgram::id)
                .containsExactly("cherokee", "wrangler");
        assertThat(repository.find(2025, null)).extracting(VehicleProgram::id).containsExactly("compass-25");
        assertThat(repository.find(null, "")).hasSize(4);
        assertThat(repository.find(2024, null)).isEmpty();
    }
}
