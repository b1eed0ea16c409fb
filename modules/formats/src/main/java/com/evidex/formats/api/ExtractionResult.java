package com.evidex.formats.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link ArchiveIndexer#extractTo}.
 *
 * @param targetDir     directory the entries were written to
 * @param extracted     entries written
 * @param skipped       entries rejected by the filter (directories are not counted)
 * @param failedEntries entry paths that could not be written
 */
public record ExtractionResult(
        Path targetDir,
        int extracted,
        int skipped,
        List<String> failedEntries
) {
    public ExtractionResult {
        failedEntries = List.copyOf(failedEntries);
    }

    public int failed() {
        return failedEntries.size();
    }
}
