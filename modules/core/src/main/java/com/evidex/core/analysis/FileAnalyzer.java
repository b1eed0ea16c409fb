package com.evidex.core.analysis;

import com.evidex.types.EvidenceCategory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A content-analysis collaborator (face detection, OCR, classification...).
 * Implementations are CDI beans picked up by {@link AnalyzerRegistry}.
 */
public interface FileAnalyzer {

    /** Stable name used in configuration and logs. */
    String name();

    boolean supports(EvidenceCategory category);

    AnalysisResult analyze(Path file) throws IOException;
}
