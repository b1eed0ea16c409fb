package com.evidex.core.repository;

import com.evidex.core.dao.AnalysisUpdate;
import com.evidex.core.dao.CategoryCount;
import com.evidex.core.dao.EvidenceFileDao;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.core.db.DatabaseService;
import com.evidex.types.EvidenceCategory;
import com.evidex.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evidence file rows.
 *
 * <p>Thread-safe: each call runs on its own handle and each mutation in its
 * own transaction. Flag state is always written as a pair in one statement.
 */
@ApplicationScoped
public class FileRepository {

    @Inject
    DatabaseService database;

    /**
     * Inserts one evidence file.
     *
     * @throws ForeignKeyViolationException if the owning case does not exist
     */
    public long addFile(NewEvidenceFile file) {
        try {
            return jdbi().inTransaction(handle -> handle.attach(EvidenceFileDao.class).insert(file));
        } catch (RuntimeException e) {
            if (SqlStates.isForeignKeyViolation(e)) {
                throw new ForeignKeyViolationException(file.caseId(), e);
            }
            throw e;
        }
    }

    public Optional<EvidenceFileRecord> getFile(long fileId) {
        return jdbi().withExtension(EvidenceFileDao.class, dao -> dao.findById(fileId));
    }

    /** @throws EvidenceFileNotFoundException if no such file exists */
    public EvidenceFileRecord requireFile(long fileId) {
        return getFile(fileId).orElseThrow(() -> new EvidenceFileNotFoundException(fileId));
    }

    /**
     * Files of a case, newest {@code date_taken} first; files without a
     * date come last, ties broken by file id.
     */
    public List<EvidenceFileRecord> getFilesByCase(long caseId, boolean flaggedOnly) {
        return jdbi().withExtension(EvidenceFileDao.class, dao -> flaggedOnly
                ? dao.findFlaggedByCase(caseId)
                : dao.findByCase(caseId));
    }

    public List<EvidenceFileRecord> getFilesByCase(long caseId) {
        return getFilesByCase(caseId, false);
    }

    /** Files of a case restricted to {@code types}; an empty set means all types. */
    public List<EvidenceFileRecord> getFilesByCase(long caseId, Set<EvidenceCategory> types) {
        if (types == null || types.isEmpty()) {
            return getFilesByCase(caseId, false);
        }
        List<String> labels = types.stream().map(EvidenceCategory::label).sorted().toList();
        return jdbi().withExtension(EvidenceFileDao.class, dao -> dao.findByCaseAndTypes(caseId, labels));
    }

    /**
     * Stores analysis output and marks the file processed. Writing the same
     * result twice leaves the row as after the first write.
     */
    public void updateAnalysis(long fileId, AnalysisUpdate analysis) {
        requireUpdated(fileId, jdbi().inTransaction(handle ->
                handle.attach(EvidenceFileDao.class).updateAnalysis(fileId, analysis.aiTags(),
                        analysis.aiConfidence(), analysis.ocrText(), analysis.faceCount())));
    }

    /** Sets {@code is_flagged} and {@code flag_reason} together. */
    public void flag(long fileId, String reason) {
        String stored = reason == null ? "" : reason;
        requireUpdated(fileId, jdbi().inTransaction(handle ->
                handle.attach(EvidenceFileDao.class).flag(fileId, stored)));
    }

    /** Clears {@code is_flagged} and {@code flag_reason} together. */
    public void unflag(long fileId) {
        requireUpdated(fileId, jdbi().inTransaction(handle ->
                handle.attach(EvidenceFileDao.class).unflag(fileId)));
    }

    /** Replaces the analyst note of a file. */
    public void addNote(long fileId, String note) {
        requireUpdated(fileId, jdbi().inTransaction(handle ->
                handle.attach(EvidenceFileDao.class).setNote(fileId, note)));
    }

    /**
     * Records the content digest of a file.
     *
     * @throws IllegalArgumentException if {@code hashHex} is not a SHA-256 hex digest
     */
    public void setHash(long fileId, String hashHex) {
        if (!ContentHash.isValidHex(hashHex)) {
            throw new IllegalArgumentException("Not a SHA-256 hex digest: " + hashHex);
        }
        String normalized = hashHex.toLowerCase();
        requireUpdated(fileId, jdbi().inTransaction(handle ->
                handle.attach(EvidenceFileDao.class).setHash(fileId, normalized)));
    }

    public List<EvidenceFileRecord> getFilesWithoutHash(long caseId) {
        return jdbi().withExtension(EvidenceFileDao.class, dao -> dao.findWithoutHash(caseId));
    }

    /** Files not yet analyzed, oldest import first. */
    public List<EvidenceFileRecord> getUnprocessedFiles(long caseId) {
        return jdbi().withExtension(EvidenceFileDao.class, dao -> dao.findUnprocessed(caseId));
    }

    public int getUnprocessedCount(long caseId) {
        return jdbi().withExtension(EvidenceFileDao.class, dao -> dao.countUnprocessed(caseId));
    }

    /** File counts per category, largest first. */
    public Map<EvidenceCategory, Long> countByCategory(long caseId) {
        List<CategoryCount> counts = jdbi().withExtension(EvidenceFileDao.class,
                dao -> dao.countByCategory(caseId));
        Map<EvidenceCategory, Long> result = new LinkedHashMap<>();
        for (CategoryCount count : counts) {
            result.put(count.category(), count.count());
        }
        return result;
    }

    private Jdbi jdbi() {
        return database.jdbi();
    }

    private static void requireUpdated(long fileId, int rows) {
        if (rows == 0) {
            throw new EvidenceFileNotFoundException(fileId);
        }
    }
}
