package com.evidex.formats.api;

import com.evidex.types.ExtractionFormat;

import java.nio.file.Path;

/**
 * Thrown when no indexer can open a container, including encrypted
 * Android backups and formats that are detected but not indexable.
 */
public class UnsupportedFormatException extends FormatException {

    private final ExtractionFormat format;

    public UnsupportedFormatException(Path source, ExtractionFormat format) {
        super("Unsupported extraction format '" + format.tag() + "' for " + source);
        this.format = format;
    }

    public UnsupportedFormatException(String message, ExtractionFormat format) {
        super(message);
        this.format = format;
    }

    public ExtractionFormat format() {
        return format;
    }
}
