package com.evidex.core.analysis;

/**
 * An analyzer failed on one file. The file keeps {@code ai_processed = false}
 * and is picked up again by the next run.
 */
public class AnalysisFailureException extends RuntimeException {

    private final long fileId;
    private final String analyzer;

    public AnalysisFailureException(long fileId, String analyzer, Throwable cause) {
        super("Analyzer '" + analyzer + "' failed on file " + fileId + ": " + cause.getMessage(), cause);
        this.fileId = fileId;
        this.analyzer = analyzer;
    }

    public long fileId() {
        return fileId;
    }

    public String analyzer() {
        return analyzer;
    }
}
