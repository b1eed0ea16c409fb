package com.evidex.core.analysis;

/**
 * Counts from one {@link AnalysisService#analyzeCase} run. Failed files are
 * still unprocessed afterwards.
 */
public record AnalysisSummary(int queued, int analyzed, int failed, boolean cancelled) {
}
