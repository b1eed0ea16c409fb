package com.evidex.formats.api;

import com.evidex.types.ExtractionFormat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Lists and extracts the entries of one opened forensic container.
 *
 * <p>{@link #index} reads entry headers only (the ZIP central directory,
 * TAR headers) so its memory use tracks the number of entries, never their
 * content. Instances are not thread-safe; callers that need parallel access
 * open one indexer per worker.
 */
public interface ArchiveIndexer extends AutoCloseable {

    ExtractionFormat format();

    /**
     * Lists every non-directory entry, reporting {@code "Indexing: <name>"}
     * after each one.
     */
    List<FileDescriptor> index(ProgressListener progress) throws IOException;

    /**
     * Writes entries accepted by {@code filter} (called with the entry path)
     * below {@code targetDir}, reporting {@code "Extracting: <name>"}.
     * A failing entry is recorded in the result and does not stop the run.
     */
    ExtractionResult extractTo(Path targetDir, Predicate<String> filter, ProgressListener progress)
            throws IOException;

    /**
     * Opens a stream over one entry's content. The caller closes it before
     * opening the next entry.
     *
     * @throws java.nio.file.NoSuchFileException if the container has no such entry
     */
    InputStream openEntry(String entryPath) throws IOException;

    @Override
    void close() throws IOException;
}
