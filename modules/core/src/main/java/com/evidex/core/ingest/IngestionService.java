package com.evidex.core.ingest;

import com.evidex.core.dao.CaseUpdate;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseRepository;
import com.evidex.formats.api.ArchiveIndexer;
import com.evidex.formats.api.ExtractionResult;
import com.evidex.formats.api.FileDescriptor;
import com.evidex.formats.api.ProgressListener;
import com.evidex.formats.api.UnsupportedFormatException;
import com.evidex.formats.detect.FormatDetector;
import com.evidex.formats.registry.IndexerRegistry;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Entry point for bringing evidence into a case.
 *
 * <ul>
 *   <li>{@link #ingest} indexes a container without extracting it (fast path)</li>
 *   <li>{@link #ingestWithFullExtraction} extracts first, then imports the tree</li>
 *   <li>{@link #importDirectory} imports an already-extracted folder</li>
 * </ul>
 * Overall progress runs on a 0..100 scale: detection 0-10, indexing 10-30,
 * processing 30-90, finalizing 95, done 100.
 */
@ApplicationScoped
public class IngestionService {

    private static final Logger log = Logger.getLogger(IngestionService.class);

    @Inject
    FormatDetector detector;

    @Inject
    IndexerRegistry registry;

    @Inject
    ParallelIngestionProcessor processor;

    @Inject
    DirectoryImporter directoryImporter;

    @Inject
    CaseRepository caseRepository;

    @Inject
    AuditRepository auditRepository;

    @Inject
    Event<IngestionCompletedEvent> completedEvent;

    @ConfigProperty(name = "evidex.ingest.worker-count", defaultValue = "4")
    int defaultWorkerCount;

    @ConfigProperty(name = "evidex.extract.temp-prefix", defaultValue = "evidex-extract-")
    String tempPrefix;

    public int defaultWorkerCount() {
        return defaultWorkerCount;
    }

    public IngestionStats ingest(Path archivePath, long caseId) throws IOException {
        return ingest(archivePath, caseId, defaultWorkerCount, ProgressListener.NONE, CancellationToken.create());
    }

    public IngestionStats ingest(Path archivePath, long caseId, int workerCount, ProgressListener progress)
            throws IOException {
        return ingest(archivePath, caseId, workerCount, progress, CancellationToken.create());
    }

    /**
     * Indexes {@code archivePath} and records one evidence row per entry.
     * Member content is never extracted; hashes stay null until backfilled.
     *
     * @throws com.evidex.core.repository.CaseNotFoundException if the case does not exist
     * @throws IllegalArgumentException if {@code workerCount} is below one
     * @throws UnsupportedFormatException if no indexer handles the detected format;
     *                                    nothing is written in that case
     */
    public IngestionStats ingest(Path archivePath, long caseId, int workerCount,
                                 ProgressListener progress, CancellationToken cancellation) throws IOException {
        ProgressListener listener = ProgressListener.orNone(progress);
        long started = System.nanoTime();
        requireWorkers(workerCount);
        caseRepository.requireCase(caseId);

        ExtractionFormat format = detect(archivePath, listener);

        List<FileDescriptor> descriptors;
        try (ArchiveIndexer indexer = registry.open(archivePath, format)) {
            descriptors = indexer.index(ProgressListener.scaled(listener, 10, 20));
        }
        log.infof("Indexed %d entries from %s (%s)", descriptors.size(), archivePath, format.tag());
        listener.onProgress(30, 100, "Indexed " + descriptors.size() + " files");

        IngestionStats stats = processor.process(descriptors, caseId, workerCount,
                ProgressListener.scaled(listener, 30, 60), cancellation);

        return finish(archivePath, caseId, format, stats, started, listener,
                AuditActions.IMPORT_EXTRACTION, "index", Map.of());
    }

    /**
     * Extracts the accepted entries of {@code archivePath} to {@code targetDir}
     * (a fresh temp directory when null) and imports the extracted tree.
     * Extracted files are kept: evidence rows point at them.
     */
    public IngestionStats ingestWithFullExtraction(Path archivePath, long caseId, Path targetDir,
                                                   Predicate<String> entryFilter, int workerCount,
                                                   ProgressListener progress, CancellationToken cancellation)
            throws IOException {
        ProgressListener listener = ProgressListener.orNone(progress);
        long started = System.nanoTime();
        requireWorkers(workerCount);
        caseRepository.requireCase(caseId);

        ExtractionFormat format = detect(archivePath, listener);
        Path target = targetDir != null
                ? Files.createDirectories(targetDir)
                : Files.createTempDirectory(tempPrefix);
        Predicate<String> filter = entryFilter == null ? path -> true : entryFilter;

        ExtractionResult extraction;
        try (ArchiveIndexer indexer = registry.open(archivePath, format)) {
            extraction = indexer.extractTo(target, filter, ProgressListener.scaled(listener, 10, 40));
        }
        log.infof("Extracted %d entries from %s to %s (%d skipped, %d failed)",
                extraction.extracted(), archivePath, target, extraction.skipped(), extraction.failed());

        String source = archivePath.toAbsolutePath().toString();
        List<Path> files = directoryImporter.listFiles(target);
        IngestionStats stats = processor.process(files,
                file -> directoryImporter.toEvidence(caseId, target, file, source),
                file -> file.getFileName().toString(),
                caseId, workerCount, ProgressListener.scaled(listener, 50, 40), cancellation)
                .withUpstreamFailures(extraction.failed());

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("extracted_to", target.toString());
        extra.put("filtered_out", extraction.skipped());
        return finish(archivePath, caseId, format, stats, started, listener,
                AuditActions.IMPORT_EXTRACTION, "full_extraction", extra);
    }

    /**
     * Imports every regular file below {@code root}.
     */
    public IngestionStats importDirectory(Path root, long caseId, int workerCount,
                                          ProgressListener progress, CancellationToken cancellation)
            throws IOException {
        ProgressListener listener = ProgressListener.orNone(progress);
        long started = System.nanoTime();
        requireWorkers(workerCount);
        caseRepository.requireCase(caseId);

        listener.onProgress(0, 100, "Scanning: " + root);
        List<Path> files = directoryImporter.listFiles(root);
        listener.onProgress(30, 100, "Found " + files.size() + " files");

        IngestionStats stats = processor.process(files,
                file -> directoryImporter.toEvidence(caseId, root, file, null),
                file -> file.getFileName().toString(),
                caseId, workerCount, ProgressListener.scaled(listener, 30, 60), cancellation);

        return finish(root, caseId, ExtractionFormat.UNKNOWN, stats, started, listener,
                AuditActions.IMPORT_DIRECTORY, "directory", Map.of());
    }

    private static void requireWorkers(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
    }

    private ExtractionFormat detect(Path archivePath, ProgressListener listener) {
        listener.onProgress(0, 100, "Detecting format: " + archivePath.getFileName());
        ExtractionFormat format = detector.detect(archivePath);
        if (format == ExtractionFormat.UNKNOWN) {
            throw new UnsupportedFormatException(archivePath, format);
        }
        listener.onProgress(10, 100, "Detected format: " + format.tag());
        return format;
    }

    private IngestionStats finish(Path source, long caseId, ExtractionFormat format, IngestionStats stats,
                                  long started, ProgressListener listener, String action, String mode,
                                  Map<String, Object> extraDetails) {
        listener.onProgress(95, 100, "Finalizing");
        String sourcePath = source.toAbsolutePath().toString();
        caseRepository.updateCase(caseId, CaseUpdate.evidenceSource(sourcePath));

        double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
        IngestionStats result = stats.finish(format, elapsed);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source_path", sourcePath);
        details.put("format", format.tag());
        details.put("mode", mode);
        details.put("total_files", result.total());
        details.put("processed", result.processed());
        details.put("errors", result.errors());
        details.put("cancelled", result.cancelled());
        details.put("elapsed_seconds", Math.round(elapsed * 1000) / 1000.0);
        details.putAll(extraDetails);
        auditRepository.log(action, caseId, details);

        completedEvent.fire(new IngestionCompletedEvent(caseId, source, result, Instant.now()));

        listener.onProgress(100, 100, String.format(Locale.ROOT,
                "Complete! Processed %d files in %.1fs", result.processed(), elapsed));
        return result;
    }
}
