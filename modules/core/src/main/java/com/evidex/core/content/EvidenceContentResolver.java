package com.evidex.core.content;

import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.ingest.EvidenceRows;
import com.evidex.formats.api.ArchiveIndexer;
import com.evidex.formats.api.ExtractionResult;
import com.evidex.formats.api.UnsupportedFormatException;
import com.evidex.formats.detect.FormatDetector;
import com.evidex.formats.registry.IndexerRegistry;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Set;

/**
 * Reads the content behind an evidence row, whether it sits on disk or is
 * still packed inside the container it was indexed from.
 */
@ApplicationScoped
public class EvidenceContentResolver {

    private static final Logger log = Logger.getLogger(EvidenceContentResolver.class);

    @Inject
    FormatDetector detector;

    @Inject
    IndexerRegistry registry;

    /** True when the row was indexed from a container and never extracted. */
    public boolean isInsideContainer(EvidenceFileRecord file) {
        return file.sourceArchive() != null
                && file.filePath().startsWith(file.sourceArchive() + EvidenceRows.CONTAINER_SEPARATOR);
    }

    /** Entry path of a packed row inside its container. */
    public String entryPath(EvidenceFileRecord file) {
        return file.filePath().substring(file.sourceArchive().length()
                + EvidenceRows.CONTAINER_SEPARATOR.length());
    }

    /**
     * Opens an indexer over a source container. The caller closes it.
     *
     * @throws UnsupportedFormatException if the container can no longer be read
     */
    public ArchiveIndexer openArchive(String sourceArchive) throws IOException {
        Path archive = Path.of(sourceArchive);
        if (!Files.isRegularFile(archive)) {
            throw new NoSuchFileException(sourceArchive, null, "Source container is missing");
        }
        ExtractionFormat format = detector.detect(archive);
        return registry.open(archive, format);
    }

    /**
     * Streams the file's content. For a packed row the returned stream also
     * releases the container when closed.
     */
    public InputStream open(EvidenceFileRecord file) throws IOException {
        if (!isInsideContainer(file)) {
            return Files.newInputStream(Path.of(file.filePath()));
        }
        ArchiveIndexer indexer = openArchive(file.sourceArchive());
        try {
            return new IndexerBoundStream(indexer.openEntry(entryPath(file)), indexer);
        } catch (IOException | RuntimeException e) {
            indexer.close();
            throw e;
        }
    }

    /**
     * Returns a path on disk holding the file's content, copying a packed
     * entry to a temp file that is deleted when the copy is closed.
     */
    public LocalCopy materialize(EvidenceFileRecord file) throws IOException {
        if (!isInsideContainer(file)) {
            Path path = Path.of(file.filePath());
            if (!Files.isRegularFile(path)) {
                throw new NoSuchFileException(file.filePath());
            }
            return new LocalCopy(path, false);
        }
        Path temp = Files.createTempFile("evidex-content-", "-" + file.fileName());
        try (InputStream in = open(file)) {
            Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debugf("Materialized %s to %s", file.filePath(), temp);
        return new LocalCopy(temp, true);
    }

    /**
     * Unpacks the given entries of a container in one pass over it.
     *
     * @throws UnsupportedFormatException if the container can no longer be read
     */
    public UnpackedContainer unpack(String sourceArchive, Collection<String> entryPaths) throws IOException {
        Path directory = Files.createTempDirectory("evidex-unpack-");
        try (ArchiveIndexer indexer = openArchive(sourceArchive)) {
            Set<String> wanted = Set.copyOf(entryPaths);
            ExtractionResult result = indexer.extractTo(directory, wanted::contains, null);
            log.debugf("Unpacked %d of %d entries from %s (%d failed)",
                    result.extracted(), wanted.size(), sourceArchive, result.failed());
            return new UnpackedContainer(sourceArchive, directory);
        } catch (IOException | RuntimeException e) {
            UnpackedContainer.deleteTree(directory);
            throw e;
        }
    }

    private static final class IndexerBoundStream extends FilterInputStream {

        private final ArchiveIndexer indexer;

        IndexerBoundStream(InputStream in, ArchiveIndexer indexer) {
            super(in);
            this.indexer = indexer;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                indexer.close();
            }
        }
    }
}
