package com.evidex.core.ingest;

import com.evidex.types.EvidenceCategory;
import com.evidex.types.ExtractionFormat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one ingestion run.
 *
 * <p>{@code processed + errors == total} unless the run was cancelled, in
 * which case the difference is {@link #skipped()}.
 */
public record IngestionStats(
        int total,
        int processed,
        int errors,
        Map<EvidenceCategory, Integer> byCategory,
        double elapsedSeconds,
        double filesPerSecond,
        ExtractionFormat format,
        boolean cancelled
) {
    public IngestionStats {
        byCategory = Collections.unmodifiableMap(byCategory.isEmpty()
                ? new EnumMap<>(EvidenceCategory.class)
                : new EnumMap<>(byCategory));
        format = format == null ? ExtractionFormat.UNKNOWN : format;
    }

    public static IngestionStats empty(ExtractionFormat format) {
        return new IngestionStats(0, 0, 0, Map.of(), 0, 0, format, false);
    }

    public int skipped() {
        return total - processed - errors;
    }

    public int count(EvidenceCategory category) {
        return byCategory.getOrDefault(category, 0);
    }

    /** Same counts, stamped with the detected format and the run's wall time. */
    public IngestionStats finish(ExtractionFormat detected, double elapsed) {
        return new IngestionStats(total, processed, errors, byCategory, elapsed,
                rate(processed, elapsed), detected, cancelled);
    }

    /** Adds entries that failed before reaching the processor, such as extraction failures. */
    public IngestionStats withUpstreamFailures(int failures) {
        if (failures == 0) {
            return this;
        }
        return new IngestionStats(total + failures, processed, errors + failures, byCategory,
                elapsedSeconds, filesPerSecond, format, cancelled);
    }

    static double rate(int processed, double elapsedSeconds) {
        return elapsedSeconds > 0 ? processed / elapsedSeconds : 0;
    }
}
