package com.evidex.formats.api;

/**
 * Thrown when a single entry cannot be read or written.
 * Per-entry failures do not abort an extraction run.
 */
public class CorruptEntryException extends FormatException {

    private final String entryPath;

    public CorruptEntryException(String entryPath, String message) {
        super(message + ": " + entryPath);
        this.entryPath = entryPath;
    }

    public CorruptEntryException(String entryPath, Throwable cause) {
        super("Failed to read entry: " + entryPath, cause);
        this.entryPath = entryPath;
    }

    public String entryPath() {
        return entryPath;
    }
}
