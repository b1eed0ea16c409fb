package com.evidex.core.analysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What one or more analyzers found in a file.
 *
 * @param tags       labels such as detected objects or scene classes
 * @param text       extracted text, or null
 * @param faceCount  faces detected
 * @param confidence overall confidence in [0, 1], or null when not reported
 */
public record AnalysisResult(
        List<String> tags,
        String text,
        int faceCount,
        Double confidence
) {
    public static final AnalysisResult EMPTY = new AnalysisResult(List.of(), null, 0, null);

    public AnalysisResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (faceCount < 0) {
            throw new IllegalArgumentException("faceCount must be >= 0");
        }
    }

    public static AnalysisResult tags(String... tags) {
        return new AnalysisResult(List.of(tags), null, 0, null);
    }

    /**
     * Combines two results: tags are unioned in order, texts joined by a
     * newline, the larger face count and confidence win.
     */
    public AnalysisResult merge(AnalysisResult other) {
        Set<String> mergedTags = new LinkedHashSet<>(tags);
        mergedTags.addAll(other.tags);

        String mergedText;
        if (text == null || text.isBlank()) {
            mergedText = other.text;
        } else if (other.text == null || other.text.isBlank()) {
            mergedText = text;
        } else {
            mergedText = text + "\n" + other.text;
        }

        Double mergedConfidence;
        if (confidence == null) {
            mergedConfidence = other.confidence;
        } else if (other.confidence == null) {
            mergedConfidence = confidence;
        } else {
            mergedConfidence = Math.max(confidence, other.confidence);
        }

        return new AnalysisResult(new ArrayList<>(mergedTags), mergedText,
                Math.max(faceCount, other.faceCount), mergedConfidence);
    }
}
