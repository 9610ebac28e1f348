package com.example.dealdesk.service;

import com.example.dealdesk.domain.RateTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RateTableResolverTest {

    private final RateTable table = RateTable.of(Map.of(36, 0.0, 72, 1.49, 84, 1.99));

    @Test
    void returnsPublishedRate() {
        assertThat(RateTableResolver.resolve(table, 72)).isEqualTo(1.49);
        assertThat(RateTableResolver.resolve(table, 36)).isZero();
    }

    @Test
    void fallsBackWhenTermIsMissing() {
        assertThat(RateTableResolver.resolve(table, 96)).isEqualTo(RateTableResolver.FALLBACK_RATE);
        assertThat(RateTableResolver.resolve(RateTable.of(Map.of()), 48)).isEqualTo(4.99);
    }

    @Test
    void readsPrefixedAndBareKeys() {
        Map<String, Double> raw = new HashMap<>();
        raw.put("rate_36", 0.99);
        raw.put("48", 1.99);
        raw.put("rate_60", null);
        RateTable parsed = RateTable.fromJson(raw);

        assertThat(parsed.find(36)).hasValue(0.99);
        assertThat(parsed.find(48)).hasValue(1.99);
        assertThat(parsed.find(60)).isEmpty();
        assertThat(parsed.toJson()).containsOnlyKeys("rate_36", "rate_48");
    }

    @Test
    void missingTableQuotesFallback() {
        assertThat(RateTableResolver.resolve(null, 60)).isEqualTo(RateTableResolver.FALLBACK_RATE);
    }

    @Test
    @DisplayName("A malformed entry is skipped, the rest of the table is kept")
    void skipsMalformedEntries() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("rate_long", 1.0);
        raw.put("rate_48", "n/a");
        raw.put("rate_60", List.of(2.99));
        raw.put("rate_72", "3,49");
        raw.put("rate_84", 5);

        RateTable parsed = RateTable.fromJson(raw);

        assertThat(parsed.toJson()).containsOnlyKeys("rate_72", "rate_84");
        assertThat(parsed.find(72)).hasValue(3.49);
        assertThat(parsed.find(84)).hasValue(5.0);
    }
}
