package com.example.dealdesk.domain;

import java.util.Map;
import java.util.TreeMap;

final class TermMaps {

    private TermMaps() {}

    // Immutable copy without null keys or values; reference tables use null for "not published"
    static Map<Integer, Double> compact(Map<Integer, Double> byTerm) {
        Map<Integer, Double> copy = new TreeMap<>();
        if (byTerm != null) {
            byTerm.forEach((term, value) -> {
                if (term != null && value != null) copy.put(term, value);
            });
        }
        return Map.copyOf(copy);
    }
}
