package com.evidex.formats.handlers;

import com.evidex.formats.api.*;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Predicate;

/**
 * Indexer for the ZIP family: plain ZIP, Cellebrite UFDR/CLBX and Oxygen OFB
 * containers all share the ZIP layout.
 * Priority 200 so signature sniffing prefers it over generic MIME matches.
 */
@ApplicationScoped
public class ZipIndexerFactory implements IndexerFactory {

    private static final byte[] ZIP_MAGIC = new byte[]{0x50, 0x4B, 0x03, 0x04}; // "PK\u0003\u0004"

    private static final Set<ExtractionFormat> FORMATS = EnumSet.of(
            ExtractionFormat.CELLEBRITE_UFDR,
            ExtractionFormat.CELLEBRITE_ZIP,
            ExtractionFormat.OXYGEN_OFB,
            ExtractionFormat.GENERIC_ZIP,
            ExtractionFormat.ZIP_ARCHIVE);

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
            Set.of("application/zip"),
            Set.of("zip", "ufdr", "ofb", "clbx"),
            ZIP_MAGIC,
            0,
            200
        );
    }

    @Override
    public Set<ExtractionFormat> supportedFormats() {
        return FORMATS;
    }

    @Override
    public ExtractionFormat sniffedFormat() {
        return ExtractionFormat.ZIP_ARCHIVE;
    }

    @Override
    public ArchiveIndexer createInstance(FileContext context) throws IOException {
        return new ZipIndexer(context);
    }

    /**
     * Indexer instance for a specific ZIP file. Listing only touches the
     * central directory; entry content is inflated on extraction or
     * {@link #openEntry} alone.
     */
    private static class ZipIndexer extends AbstractArchiveIndexer {
        private static final Logger log = Logger.getLogger(ZipIndexer.class);

        private final ZipFile zipFile;

        ZipIndexer(FileContext context) throws IOException {
            super(context);
            this.zipFile = ZipFile.builder().setPath(context.source()).get();
        }

        @Override
        public List<FileDescriptor> index(ProgressListener progress) {
            ProgressListener listener = ProgressListener.orNone(progress);
            List<ZipArchiveEntry> entries = Collections.list(zipFile.getEntries());
            int total = entries.size();
            List<FileDescriptor> descriptors = new ArrayList<>(total);

            for (int i = 0; i < total; i++) {
                ZipArchiveEntry entry = entries.get(i);
                if (entry.isDirectory()) {
                    continue;
                }
                FileDescriptor descriptor = describe(entry.getName(), entry.getSize(), entryMetadata(entry));
                descriptors.add(descriptor);
                listener.onProgress(i + 1, total, "Indexing: " + descriptor.name());
            }

            log.debugf("Indexed %d of %d entries in %s", descriptors.size(), total, context.filename());
            return descriptors;
        }

        @Override
        public ExtractionResult extractTo(Path targetDir, Predicate<String> filter, ProgressListener progress)
                throws IOException {
            ProgressListener listener = ProgressListener.orNone(progress);
            Files.createDirectories(targetDir);
            List<ZipArchiveEntry> entries = Collections.list(zipFile.getEntries());
            int total = entries.size();
            int extracted = 0;
            int skipped = 0;
            List<String> failed = new ArrayList<>();

            for (int i = 0; i < total; i++) {
                ZipArchiveEntry entry = entries.get(i);
                String entryPath = entry.getName();
                if (entry.isDirectory()) {
                    continue;
                }
                if (filter != null && !filter.test(entryPath)) {
                    skipped++;
                    continue;
                }
                try (InputStream in = zipFile.getInputStream(entry)) {
                    writeEntry(in, resolveTarget(targetDir, entryPath), entryMetadata(entry));
                    extracted++;
                } catch (IOException | RuntimeException e) {
                    log.warnf(e, "Failed to extract %s from %s", entryPath, context.filename());
                    failed.add(entryPath);
                }
                listener.onProgress(i + 1, total, "Extracting: " + baseName(entryPath));
            }

            return new ExtractionResult(targetDir, extracted, skipped, failed);
        }

        @Override
        public InputStream openEntry(String entryPath) throws IOException {
            ZipArchiveEntry entry = zipFile.getEntry(entryPath);
            if (entry == null || entry.isDirectory()) {
                throw new NoSuchFileException(entryPath, context.source().toString(), "No such entry");
            }
            return zipFile.getInputStream(entry);
        }

        @Override
        public void close() throws IOException {
            zipFile.close();
        }

        private static EntryMetadata entryMetadata(ZipArchiveEntry entry) {
            return EntryMetadata.of(entry.getLastModifiedTime(), entry.getCreationTime(), entry.getLastAccessTime());
        }
    }
}
