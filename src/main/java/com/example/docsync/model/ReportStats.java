package com.example.docsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counters of a consistency report.
 *
 * @param issueCount  number of code terms missing from the documentation
 * @param syncedCount number of terms shared by code and documentation
 * @param breakdown   categorized counters (entities per kind, documented entities, zombie terms, ...)
 */
public record ReportStats(
        int issueCount,
        int syncedCount,
        Map<String, Integer> breakdown
) {
    public ReportStats {
        breakdown = breakdown != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(breakdown))
                : Map.of();
    }

    public static ReportStats empty() {
        return new ReportStats(0, 0, Map.of());
    }
}
