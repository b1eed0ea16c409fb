package com.evidex.core.hash;

/**
 * The content digest of an evidence file could not be computed.
 */
public class HashComputationException extends RuntimeException {

    private final long fileId;

    public HashComputationException(long fileId, String message, Throwable cause) {
        super("Cannot hash evidence file " + fileId + ": " + message, cause);
        this.fileId = fileId;
    }

    public long fileId() {
        return fileId;
    }
}
