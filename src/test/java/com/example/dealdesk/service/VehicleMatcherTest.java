package com.example.dealdesk.service;

import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.domain.VehicleProgram;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VehicleMatcherTest {

    private static VehicleProgram program(String brand, String model, String trim, int year) {
        return new VehicleProgram("id", brand, model, trim, year, 0, 0, null, null);
    }

    private static ResidualEntry residual(String brand, String model, String trim, String body) {
        return new ResidualEntry(brand, model, trim, body, 2026, Map.of(36, 55.0));
    }

    private static LeaseRateEntry rates(String brand, String model, Integer year) {
        return new LeaseRateEntry(brand, model, year, Map.of(36, 4.99), Map.of(), 0);
    }

    @Nested
    @DisplayName("Residuals")
    class Residuals {

        private final ResidualEntry crewCab = residual("Ram", "1500", "Big Horn", "Crew Cab 4x4");
        private final ResidualEntry quadCab = residual("Ram", "1500", "Big Horn", "Quad Cab 4x4");
        private final List<ResidualEntry> table = List.of(
                residual("Jeep", "Grand Cherokee", "Laredo", "4dr 4x4"), crewCab, quadCab);

        @Test
        void matchesIgnoringCase() {
            assertThat(VehicleMatcher.matchResidual(program("RAM", "1500", "big horn", 2026), table)).contains(crewCab);
        }

        @Test
        void modelContainmentWorksBothWays() {
            ResidualEntry longName = residual("Jeep", "Grand Cherokee L", "Laredo", null);

            assertThat(VehicleMatcher.matchResidual(program("Jeep", "Grand Cherokee", "Laredo", 2026), List.of(longName)))
                    .contains(longName);
            assertThat(VehicleMatcher.matchResidual(program("Jeep", "Grand Cherokee L Overland", "Laredo", 2026), List.of(longName)))
                    .contains(longName);
        }

        @Test
        void bodyStylePreferredWhenGiven() {
            assertThat(VehicleMatcher.matchResidual(program("Ram", "1500", "Big Horn", 2026), table, "quad cab 4x4"))
                    .contains(quadCab);
        }

        @Test
        void unknownBodyStyleFallsBackToFirstMatch() {
            assertThat(VehicleMatcher.matchResidual(program("Ram", "1500", "Big Horn", 2026), table, "Regular Cab"))
                    .contains(crewCab);
        }

        @Test
        void emptyTrimOnEitherSideMatches() {
            ResidualEntry noTrim = residual("Chrysler", "Pacifica", "", "Minivan");

            assertThat(VehicleMatcher.matchResidual(program("Chrysler", "Pacifica", "Limited", 2026), List.of(noTrim)))
                    .contains(noTrim);
            assertThat(VehicleMatcher.matchResidual(program("Ram", "1500", null, 2026), table)).contains(crewCab);
        }

        @Test
        void differentBrandOrTrimDoesNotMatch() {
            assertThat(VehicleMatcher.matchResidual(program("Dodge", "1500", "Big Horn", 2026), table)).isEmpty();
            assertThat(VehicleMatcher.matchResidual(program("Ram", "1500", "Rebel", 2026), table)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lease rates")
    class LeaseRates {

        @Test
        void prefersEntryNamingTheTrim() {
            LeaseRateEntry generic = rates("Ram", "1500", 2026);
            LeaseRateEntry bigHorn = rates("Ram", "1500 Big Horn, Sport", 2026);

            assertThat(VehicleMatcher.matchLeaseRate(program("Ram", "1500", "Big Horn", 2026), List.of(generic, bigHorn)))
                    .contains(bigHorn);
        }

        @Test
        void matchesAnyCommaSeparatedTrim() {
            LeaseRateEntry sport = rates("Ram", "1500 Sport", 2026);
            LeaseRateEntry generic = rates("Ram", "1500", 2026);

            assertThat(VehicleMatcher.matchLeaseRate(program("Ram", "1500", "Big Horn, Sport", 2026), List.of(generic, sport)))
                    .contains(sport);
        }

        @Test
        void fallsBackToModelOnly() {
            LeaseRateEntry generic = rates("Ram", "1500", 2026);

            assertThat(VehicleMatcher.matchLeaseRate(program("Ram", "1500", "Tradesman", 2026), List.of(generic)))
                    .contains(generic);
        }

        @Test
        void modelYearMustAgreeWhenBothKnown() {
            LeaseRateEntry lastYear = rates("Chrysler", "Pacifica", 2025);
            LeaseRateEntry undated = rates("Chrysler", "Pacifica", null);

            assertThat(VehicleMatcher.matchLeaseRate(program("Chrysler", "Pacifica", null, 2026), List.of(lastYear))).isEmpty();
            assertThat(VehicleMatcher.matchLeaseRate(program("Chrysler", "Pacifica", null, 2026), List.of(lastYear, undated)))
                    .contains(undated);
            assertThat(VehicleMatcher.matchLeaseRate(program("Chrysler", "Pacifica", null, 0), List.of(lastYear)))
                    .contains(lastYear);
        }
    }

    @Test
    void trimTokensIgnoreBlanks() {
        assertThat(VehicleMatcher.modelNamesTrim("grand cherokee laredo", "laredo, ,")).isTrue();
        assertThat(VehicleMatcher.modelNamesTrim("grand cherokee", "summit, ")).isFalse();
        assertThat(VehicleMatcher.trimMatches("", "laredo")).isTrue();
    }
}
