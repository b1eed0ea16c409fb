package com.evidex.core.analysis;

import com.evidex.core.content.EvidenceContentResolver;
import com.evidex.core.content.LocalCopy;
import com.evidex.core.content.UnpackedContainer;
import com.evidex.core.dao.AnalysisUpdate;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.ingest.CancellationToken;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.ProgressListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works through the analysis queue of a case: every file with
 * {@code ai_processed = false}, oldest import first.
 */
@ApplicationScoped
public class AnalysisService {

    private static final Logger log = Logger.getLogger(AnalysisService.class);

    @Inject
    AnalyzerRegistry analyzers;

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    AuditRepository auditRepository;

    @Inject
    EvidenceContentResolver contentResolver;

    @Inject
    ObjectMapper objectMapper;

    public AnalysisSummary analyzeCase(long caseId, ProgressListener progress) {
        return analyzeCase(caseId, progress, CancellationToken.create());
    }

    /**
     * Runs the enabled analyzers over the case's unprocessed files. A file
     * whose analysis fails stays unprocessed and the run moves on. Loose
     * files go first, then packed files one container at a time, each
     * container unpacked once.
     */
    public AnalysisSummary analyzeCase(long caseId, ProgressListener progress, CancellationToken cancellation) {
        caseRepository.requireCase(caseId);
        List<EvidenceFileRecord> queue = fileRepository.getUnprocessedFiles(caseId);
        log.infof("Case %d: %d files queued for analysis", caseId, queue.size());

        List<EvidenceFileRecord> loose = new ArrayList<>();
        Map<String, List<EvidenceFileRecord>> byArchive = new LinkedHashMap<>();
        for (EvidenceFileRecord file : queue) {
            if (contentResolver.isInsideContainer(file) && !analyzers.forCategory(file.fileType()).isEmpty()) {
                byArchive.computeIfAbsent(file.sourceArchive(), k -> new ArrayList<>()).add(file);
            } else {
                loose.add(file);
            }
        }

        Tally tally = new Tally(queue.size(), ProgressListener.orNone(progress));
        for (EvidenceFileRecord file : loose) {
            if (cancellation.isCancelled()) {
                break;
            }
            tally.record(file, () -> analyze(file, () -> contentResolver.materialize(file)));
        }
        for (Map.Entry<String, List<EvidenceFileRecord>> group : byArchive.entrySet()) {
            if (cancellation.isCancelled()) {
                break;
            }
            analyzeContainer(group.getKey(), group.getValue(), tally, cancellation);
        }

        boolean cancelled = tally.done < queue.size();
        AnalysisSummary summary = new AnalysisSummary(queue.size(), tally.analyzed, tally.failed, cancelled);
        auditRepository.log(AuditActions.ANALYZE_CASE, caseId, Map.of(
                "queued", summary.queued(),
                "analyzed", summary.analyzed(),
                "failed", summary.failed(),
                "cancelled", summary.cancelled()));
        return summary;
    }

    /**
     * Analyzes a single file, whether or not it was processed before.
     *
     * @throws AnalysisFailureException if the content cannot be read or an analyzer fails
     */
    public AnalysisResult analyzeFile(long fileId) {
        EvidenceFileRecord file = fileRepository.requireFile(fileId);
        return analyze(file, () -> contentResolver.materialize(file));
    }

    private void analyzeContainer(String archive, List<EvidenceFileRecord> files,
                                  Tally tally, CancellationToken cancellation) {
        List<String> entries = files.stream().map(contentResolver::entryPath).toList();
        try (UnpackedContainer unpacked = contentResolver.unpack(archive, entries)) {
            for (EvidenceFileRecord file : files) {
                if (cancellation.isCancelled()) {
                    return;
                }
                tally.record(file, () -> analyze(file, () -> unpacked.copyOf(contentResolver.entryPath(file))));
            }
        } catch (IOException | RuntimeException e) {
            log.errorf("Cannot open container %s for analysis: %s", archive, e.getMessage());
            for (EvidenceFileRecord file : files) {
                tally.fail(file, new AnalysisFailureException(file.fileId(), "content", e));
            }
        }
    }

    private AnalysisResult analyze(EvidenceFileRecord file, ContentSource source) {
        List<FileAnalyzer> applicable = analyzers.forCategory(file.fileType());
        AnalysisResult merged = AnalysisResult.EMPTY;
        if (!applicable.isEmpty()) {
            try (LocalCopy copy = source.open()) {
                for (FileAnalyzer analyzer : applicable) {
                    merged = merged.merge(run(analyzer, file, copy));
                }
            } catch (AnalysisFailureException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                throw new AnalysisFailureException(file.fileId(), "content", e);
            }
        }
        try {
            fileRepository.updateAnalysis(file.fileId(), new AnalysisUpdate(
                    encodeTags(merged.tags()), merged.confidence(), merged.text(), merged.faceCount()));
        } catch (RuntimeException e) {
            throw new AnalysisFailureException(file.fileId(), "store", e);
        }
        log.debugf("Analyzed %s: %d tags, %d faces", file.fileName(), merged.tags().size(), merged.faceCount());
        return merged;
    }

    private static AnalysisResult run(FileAnalyzer analyzer, EvidenceFileRecord file, LocalCopy copy) {
        try {
            AnalysisResult result = analyzer.analyze(copy.path());
            return result == null ? AnalysisResult.EMPTY : result;
        } catch (IOException | RuntimeException e) {
            throw new AnalysisFailureException(file.fileId(), analyzer.name(), e);
        }
    }

    @FunctionalInterface
    private interface ContentSource {
        LocalCopy open() throws IOException;
    }

    /** Running counts of one analysis run; each file is counted once. */
    private static final class Tally {
        private final int total;
        private final ProgressListener listener;
        private final Set<Long> seen = new HashSet<>();
        private int analyzed;
        private int failed;
        private int done;

        Tally(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }

        void record(EvidenceFileRecord file, Runnable analysis) {
            try {
                analysis.run();
                if (seen.add(file.fileId())) {
                    analyzed++;
                    step(file);
                }
            } catch (AnalysisFailureException e) {
                fail(file, e);
            }
        }

        void fail(EvidenceFileRecord file, AnalysisFailureException e) {
            if (seen.add(file.fileId())) {
                failed++;
                log.warn(e.getMessage());
                step(file);
            }
        }

        private void step(EvidenceFileRecord file) {
            listener.onProgress(++done, total, "Analyzing: " + file.fileName());
        }
    }

    private String encodeTags(List<String> tags) {
        if (tags.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize analysis tags", e);
        }
    }
}
