package com.evidex.core.hash;

import com.evidex.core.content.EvidenceContentResolver;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.ArchiveIndexer;
import com.evidex.formats.api.ProgressListener;
import com.evidex.util.ContentHash;
import com.evidex.util.ContentHasher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes content digests that ingestion deferred.
 *
 * <p>Rows are inserted with a null {@code file_hash}. A digest is computed the
 * first time someone asks for it ({@link #ensureHash}) or for a whole case on
 * request ({@link #backfillCase}). Packed entries are streamed out of their
 * container, one container open per archive.
 */
@ApplicationScoped
public class HashBackfillService {

    private static final Logger log = Logger.getLogger(HashBackfillService.class);

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    AuditRepository auditRepository;

    @Inject
    EvidenceContentResolver contentResolver;

    /**
     * Returns the stored digest, computing and storing it first if missing.
     *
     * @throws HashComputationException if the content cannot be read
     */
    public String ensureHash(long fileId) {
        EvidenceFileRecord file = fileRepository.requireFile(fileId);
        if (file.fileHash() != null) {
            return file.fileHash();
        }
        ContentHash hash;
        try (InputStream in = contentResolver.open(file)) {
            hash = ContentHasher.hash(in);
        } catch (IOException e) {
            throw new HashComputationException(fileId, e.getMessage(), e);
        }
        fileRepository.setHash(fileId, hash.toHex());
        log.debugf("Hashed file %d: %s", fileId, hash);
        return hash.toHex();
    }

    /**
     * Hashes every file of the case that has no digest yet. A file that
     * cannot be read is logged and counted, the rest continue.
     */
    public BackfillResult backfillCase(long caseId, ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNone(progress);
        caseRepository.requireCase(caseId);
        List<EvidenceFileRecord> pending = fileRepository.getFilesWithoutHash(caseId);

        List<EvidenceFileRecord> onDisk = new ArrayList<>();
        Map<String, List<EvidenceFileRecord>> byArchive = new LinkedHashMap<>();
        for (EvidenceFileRecord file : pending) {
            if (contentResolver.isInsideContainer(file)) {
                byArchive.computeIfAbsent(file.sourceArchive(), k -> new ArrayList<>()).add(file);
            } else {
                onDisk.add(file);
            }
        }

        Counter counter = new Counter(pending.size(), listener);
        for (EvidenceFileRecord file : onDisk) {
            try (InputStream in = contentResolver.open(file)) {
                store(file, ContentHasher.hash(in), counter);
            } catch (IOException | RuntimeException e) {
                counter.failed(file, e);
            }
        }
        for (Map.Entry<String, List<EvidenceFileRecord>> entry : byArchive.entrySet()) {
            hashArchive(entry.getKey(), entry.getValue(), counter);
        }

        BackfillResult result = new BackfillResult(pending.size(), counter.hashed, counter.failed);
        auditRepository.log(AuditActions.HASH_BACKFILL, caseId, Map.of(
                "candidates", result.candidates(),
                "hashed", result.hashed(),
                "failed", result.failed()));
        log.infof("Case %d: hashed %d of %d files (%d failed)",
                caseId, result.hashed(), result.candidates(), result.failed());
        return result;
    }

    private void hashArchive(String archive, List<EvidenceFileRecord> files, Counter counter) {
        try (ArchiveIndexer indexer = contentResolver.openArchive(archive)) {
            for (EvidenceFileRecord file : files) {
                try (InputStream in = indexer.openEntry(contentResolver.entryPath(file))) {
                    store(file, ContentHasher.hash(in), counter);
                } catch (IOException | RuntimeException e) {
                    counter.failed(file, e);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.errorf("Cannot open container %s for hashing: %s", archive, e.getMessage());
            for (EvidenceFileRecord file : files) {
                if (!counter.seen(file)) {
                    counter.failed(file, e);
                }
            }
        }
    }

    private void store(EvidenceFileRecord file, ContentHash hash, Counter counter) {
        fileRepository.setHash(file.fileId(), hash.toHex());
        counter.hashed(file);
    }

    private static final class Counter {
        private final int total;
        private final ProgressListener listener;
        private final Set<Long> done = new HashSet<>();
        int hashed;
        int failed;

        Counter(int total, ProgressListener listener) {
            this.total = total;
            this.listener = listener;
        }

        void hashed(EvidenceFileRecord file) {
            hashed++;
            advance(file, "Hashed: ");
        }

        void failed(EvidenceFileRecord file, Exception e) {
            failed++;
            log.warnf("Cannot hash %s: %s", file.filePath(), e.getMessage());
            advance(file, "Failed: ");
        }

        boolean seen(EvidenceFileRecord file) {
            return done.contains(file.fileId());
        }

        private void advance(EvidenceFileRecord file, String prefix) {
            done.add(file.fileId());
            listener.onProgress(done.size(), total, prefix + file.fileName());
        }
    }
}
