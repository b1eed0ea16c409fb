package com.evidex.formats.handlers;

import com.evidex.formats.api.*;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarFile;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Predicate;

/**
 * Indexer for TAR archives, plain or wrapped in a gzip/bzip2 {@link Codec}.
 * Priority 200 so signature sniffing prefers it over generic MIME matches.
 * Uses magicOffset=257 for TAR magic detection ("ustar").
 */
@ApplicationScoped
public class TarIndexerFactory implements IndexerFactory {

    private static final byte[] TAR_MAGIC = new byte[]{'u', 's', 't', 'a', 'r'};

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
            Set.of("application/x-tar", "application/x-gtar"),
            Set.of("tar", "tgz", "tbz2"),
            TAR_MAGIC,
            257,  // TAR magic is at offset 257
            200
        );
    }

    @Override
    public Set<ExtractionFormat> supportedFormats() {
        return EnumSet.of(ExtractionFormat.TAR_ARCHIVE);
    }

    @Override
    public ExtractionFormat sniffedFormat() {
        return ExtractionFormat.TAR_ARCHIVE;
    }

    @Override
    public ArchiveIndexer createInstance(FileContext context) throws IOException {
        if (context.codec().isPresent()) {
            return new CompressedTarIndexer(context, context.codec().get());
        }
        return new TarFileIndexer(context);
    }

    /**
     * Random-access indexer for an uncompressed tarball: {@link TarFile}
     * seeks from header to header without reading entry bodies.
     */
    private static class TarFileIndexer extends AbstractArchiveIndexer {
        private static final Logger log = Logger.getLogger(TarFileIndexer.class);

        private final TarFile tarFile;

        TarFileIndexer(FileContext context) throws IOException {
            super(context);
            this.tarFile = new TarFile(context.source());
        }

        @Override
        public List<FileDescriptor> index(ProgressListener progress) {
            ProgressListener listener = ProgressListener.orNone(progress);
            List<TarArchiveEntry> entries = tarFile.getEntries();
            int total = entries.size();
            List<FileDescriptor> descriptors = new ArrayList<>(total);

            for (int i = 0; i < total; i++) {
                TarArchiveEntry entry = entries.get(i);
                if (entry.isDirectory() || !entry.isFile()) {
                    continue;
                }
                FileDescriptor descriptor = describe(entry.getName(), entry.getSize(), TarEntries.metadata(entry));
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
            List<TarArchiveEntry> entries = tarFile.getEntries();
            int total = entries.size();
            int extracted = 0;
            int skipped = 0;
            List<String> failed = new ArrayList<>();

            for (int i = 0; i < total; i++) {
                TarArchiveEntry entry = entries.get(i);
                String entryPath = entry.getName();
                if (entry.isDirectory() || !entry.isFile()) {
                    continue;
                }
                if (filter != null && !filter.test(entryPath)) {
                    skipped++;
                    continue;
                }
                try (InputStream in = tarFile.getInputStream(entry)) {
                    writeEntry(in, resolveTarget(targetDir, entryPath), TarEntries.metadata(entry));
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
            for (TarArchiveEntry entry : tarFile.getEntries()) {
                if (entry.isFile() && entry.getName().equals(entryPath)) {
                    return tarFile.getInputStream(entry);
                }
            }
            throw new NoSuchFileException(entryPath, context.source().toString(), "No such entry");
        }

        @Override
        public void close() throws IOException {
            tarFile.close();
        }
    }

    private static class CompressedTarIndexer extends StreamedTarIndexer {
        private final Codec codec;

        CompressedTarIndexer(FileContext context, Codec codec) {
            super(context);
            this.codec = codec;
        }

        @Override
        protected InputStream openTarStream() throws IOException {
            InputStream raw = new BufferedInputStream(Files.newInputStream(context.source()));
            try {
                return codec.decode(raw);
            } catch (IOException | RuntimeException e) {
                raw.close();
                throw e;
            }
        }
    }
}
