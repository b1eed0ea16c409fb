package com.evidex.core.dao;

/**
 * Analysis columns written by {@link EvidenceFileDao#updateAnalysis}.
 *
 * @param aiTags       JSON array of tags, or null
 * @param aiConfidence overall confidence in [0, 1], or null
 * @param ocrText      extracted text, or null
 * @param faceCount    number of faces detected
 */
public record AnalysisUpdate(
        String aiTags,
        Double aiConfidence,
        String ocrText,
        int faceCount
) {}
