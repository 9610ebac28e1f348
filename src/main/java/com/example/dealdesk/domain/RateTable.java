package com.example.dealdesk.domain;

import com.example.dealdesk.util.NumberParsing;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Immutable per-program table of nominal annual percentage rates keyed by financing term.
 *
 * The table is sparse: any of the supported terms may be missing. In JSON the table is an
 * object keyed {@code rate_36 ... rate_96}; bare term keys ({@code "36"}) are accepted too.
 */
@Slf4j
public final class RateTable {
    /** Financing terms, in months, a program can quote. */
    public static final List<Integer> SUPPORTED_TERMS = List.of(36, 48, 60, 72, 84, 96);

    private static final String KEY_PREFIX = "rate_";

    private final Map<Integer, Double> ratesByTerm;

    private RateTable(Map<Integer, Double> ratesByTerm) {
        this.ratesByTerm = Collections.unmodifiableMap(new TreeMap<>(ratesByTerm));
    }

    public static RateTable empty() {
        return new RateTable(Map.of());
    }

    public static RateTable of(Map<Integer, Double> ratesByTerm) {
        Map<Integer, Double> copy = new TreeMap<>();
        ratesByTerm.forEach((term, rate) -> {
            if (term != null && rate != null) copy.put(term, rate);
        });
        return new RateTable(copy);
    }

    /**
     * Reads a published rate table. An entry whose key is not a term or whose rate is not a
     * number is logged and skipped; the rest of the table is kept.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RateTable fromJson(Map<String, ?> raw) {
        Map<Integer, Double> parsed = new TreeMap<>();
        if (raw != null) {
            for (Map.Entry<String, ?> e : raw.entrySet()) {
                if (e.getValue() == null) continue;
                Integer term = parseTerm(e.getKey());
                Double rate = parseRate(e.getValue());
                if (term == null || rate == null) {
                    log.warn("Skipping rate table entry {}={}", e.getKey(), e.getValue());
                    continue;
                }
                parsed.put(term, rate);
            }
        }
        return new RateTable(parsed);
    }

    private static Integer parseTerm(String key) {
        String bare = key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
        try {
            return Integer.parseInt(bare.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseRate(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String text) return NumberParsing.parseOrNull(text);
        return null;
    }

    /** @return the rate quoted for the term, or empty when the program has no entry for it */
    public OptionalDouble find(int term) {
        Double rate = ratesByTerm.get(term);
        return rate == null ? OptionalDouble.empty() : OptionalDouble.of(rate);
    }

    @JsonValue
    public Map<String, Double> toJson() {
        Map<String, Double> out = new LinkedHashMap<>();
        ratesByTerm.forEach((term, rate) -> out.put(KEY_PREFIX + term, rate));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RateTable other && ratesByTerm.equals(other.ratesByTerm);
    }

    @Override
    public int hashCode() {
        return ratesByTerm.hashCode();
    }

    @Override
    public String toString() {
        return "RateTable" + ratesByTerm;
    }
}
