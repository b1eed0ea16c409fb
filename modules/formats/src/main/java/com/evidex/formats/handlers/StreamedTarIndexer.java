package com.evidex.formats.handlers;

import com.evidex.formats.api.EntryMetadata;
import com.evidex.formats.api.ExtractionResult;
import com.evidex.formats.api.FileContext;
import com.evidex.formats.api.FileDescriptor;
import com.evidex.formats.api.ProgressListener;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Indexer over a TAR stream that cannot be seeked: compressed tarballs and
 * Android backups. Headers are read in order and entry bodies are skipped,
 * so the total entry count is only known once the stream ends. Reports carry
 * an unknown total until a final report with {@code current == total}.
 */
abstract class StreamedTarIndexer extends AbstractArchiveIndexer {
    private static final Logger log = Logger.getLogger(StreamedTarIndexer.class);

    StreamedTarIndexer(FileContext context) {
        super(context);
    }

    /** Opens a fresh decoded TAR stream positioned at the first header. */
    protected abstract InputStream openTarStream() throws IOException;

    @Override
    public List<FileDescriptor> index(ProgressListener progress) throws IOException {
        ProgressListener listener = ProgressListener.orNone(progress);
        List<FileDescriptor> descriptors = new ArrayList<>();
        int position = 0;

        try (TarArchiveInputStream tar = new TarArchiveInputStream(openTarStream())) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                position++;
                if (entry.isDirectory() || !entry.isFile()) {
                    continue;
                }
                FileDescriptor descriptor = describe(entry.getName(), entry.getSize(), TarEntries.metadata(entry));
                descriptors.add(descriptor);
                listener.onProgress(position, 0, "Indexing: " + descriptor.name());
            }
        }
        listener.onProgress(position, position, "Indexed " + position + " entries");

        log.debugf("Indexed %d of %d entries in %s", descriptors.size(), position, context.filename());
        return descriptors;
    }

    @Override
    public ExtractionResult extractTo(Path targetDir, Predicate<String> filter, ProgressListener progress)
            throws IOException {
        ProgressListener listener = ProgressListener.orNone(progress);
        Files.createDirectories(targetDir);
        int position = 0;
        int extracted = 0;
        int skipped = 0;
        List<String> failed = new ArrayList<>();

        try (TarArchiveInputStream tar = new TarArchiveInputStream(openTarStream())) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                position++;
                String entryPath = entry.getName();
                if (entry.isDirectory() || !entry.isFile()) {
                    continue;
                }
                if (filter != null && !filter.test(entryPath)) {
                    skipped++;
                    continue;
                }
                try {
                    writeEntry(tar, resolveTarget(targetDir, entryPath), TarEntries.metadata(entry));
                    extracted++;
                } catch (IOException | RuntimeException e) {
                    log.warnf(e, "Failed to extract %s from %s", entryPath, context.filename());
                    failed.add(entryPath);
                }
                listener.onProgress(position, 0, "Extracting: " + baseName(entryPath));
            }
        }
        listener.onProgress(position, position, "Extracted " + extracted + " of " + position + " entries");

        return new ExtractionResult(targetDir, extracted, skipped, failed);
    }

    @Override
    public InputStream openEntry(String entryPath) throws IOException {
        TarArchiveInputStream tar = new TarArchiveInputStream(openTarStream());
        try {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isFile() && entry.getName().equals(entryPath)) {
                    // The stream now reads this entry's body; closing it closes the container
                    return tar;
                }
            }
        } catch (IOException | RuntimeException e) {
            tar.close();
            throw e;
        }
        tar.close();
        throw new NoSuchFileException(entryPath, context.source().toString(), "No such entry");
    }

    @Override
    public void close() {
        // Every operation opens and closes its own stream
    }
}
