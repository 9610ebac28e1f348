package com.example.dealdesk.service;

import com.example.dealdesk.domain.LeaseRateEntry;
import com.example.dealdesk.domain.ResidualEntry;
import com.example.dealdesk.domain.VehicleProgram;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Finds the residual and lease-rate records describing a financing program's vehicle.
 *
 * The reference tables are published independently of the programs and name vehicles
 * loosely, so matching is case-insensitive and based on substring containment:
 * <ul>
 *   <li>brands must be equal;</li>
 *   <li>models match when either name contains the other;</li>
 *   <li>trims match when either contains the other or when either side has no trim.</li>
 * </ul>
 * The first record in table order that satisfies the rules wins.
 */
public final class VehicleMatcher {

    private VehicleMatcher() {}

    public static Optional<ResidualEntry> matchResidual(VehicleProgram program, Collection<ResidualEntry> entries) {
        return matchResidual(program, entries, null);
    }

    /**
     * Matches a residual record. When a body style is known, a record of that exact body style
     * is preferred; otherwise, or when none qualifies, body style is ignored.
     */
    public static Optional<ResidualEntry> matchResidual(VehicleProgram program, Collection<ResidualEntry> entries,
                                                        String bodyStyle) {
        String brand = normalize(program.brand());
        String model = normalize(program.model());
        String trim = normalize(program.trim());
        String body = normalize(bodyStyle);

        Predicate<ResidualEntry> vehicle = e -> brand.equals(normalize(e.brand()))
                && eitherContains(normalize(e.modelName()), model)
                && trimMatches(normalize(e.trim()), trim);

        if (!body.isEmpty()) {
            Optional<ResidualEntry> precise = entries.stream()
                    .filter(vehicle.and(e -> body.equals(normalize(e.bodyStyle()))))
                    .findFirst();
            if (precise.isPresent()) return precise;
        }
        return entries.stream().filter(vehicle).findFirst();
    }

    /**
     * Matches a lease-rate record. Lease-rate tables fold trim names into the model column, so
     * a first pass requires the program's trim (or one of its comma-separated names) to appear
     * there; a second pass settles for the model alone.
     */
    public static Optional<LeaseRateEntry> matchLeaseRate(VehicleProgram program, Collection<LeaseRateEntry> entries) {
        String brand = normalize(program.brand());
        String model = normalize(program.model());
        String trim = normalize(program.trim());

        Predicate<LeaseRateEntry> sameVehicle = e -> brand.equals(normalize(e.brand()))
                && (e.modelYear() == null || program.year() == 0 || e.modelYear() == program.year())
                && eitherContains(normalize(e.model()), model);

        Optional<LeaseRateEntry> withTrim = entries.stream()
                .filter(sameVehicle.and(e -> trim.isEmpty() || modelNamesTrim(normalize(e.model()), trim)))
                .findFirst();
        if (withTrim.isPresent()) return withTrim;
        return entries.stream().filter(sameVehicle).findFirst();
    }

    static boolean trimMatches(String candidateTrim, String trim) {
        return trim.isEmpty() || candidateTrim.isEmpty() || eitherContains(candidateTrim, trim);
    }

    static boolean modelNamesTrim(String candidateModel, String trim) {
        if (candidateModel.contains(trim)) return true;
        for (String token : trim.split(",")) {
            String t = token.trim();
            if (!t.isEmpty() && candidateModel.contains(t)) return true;
        }
        return false;
    }

    private static boolean eitherContains(String a, String b) {
        return a.contains(b) || b.contains(a);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
