package com.example.dealdesk.service;

import com.example.dealdesk.domain.RateTable;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the financing rate for a term out of a program's sparse rate table.
 */
@Slf4j
public final class RateTableResolver {
    /** Rate quoted when the table has no entry for the term. Not a real offer. */
    public static final double FALLBACK_RATE = 4.99;

    private RateTableResolver() {}

    public static double resolve(RateTable table, int term) {
        if (table == null) {
            log.warn("No rate table, quoting fallback rate {}% for {} months", FALLBACK_RATE, term);
            return FALLBACK_RATE;
        }
        return table.find(term).orElseGet(() -> {
            log.warn("No rate for {} months, quoting fallback rate {}%", term, FALLBACK_RATE);
            return FALLBACK_RATE;
        });
    }
}
