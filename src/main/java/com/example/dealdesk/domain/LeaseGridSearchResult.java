package com.example.dealdesk.domain;

import java.util.List;

// best is null when no combination could be priced
public record LeaseGridSearchResult(BestLeaseOption best, List<LeaseGridRow> grid) {

    public LeaseGridSearchResult {
        grid = grid == null ? List.of() : List.copyOf(grid);
    }
}
