package com.evidex.core.repository;

import com.evidex.core.dao.CaseDao;
import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseStatisticsRecord;
import com.evidex.core.dao.CaseUpdate;
import com.evidex.core.dao.NewCase;
import com.evidex.core.db.DatabaseService;
import com.evidex.types.CaseStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Case rows and their aggregate counters.
 *
 * <p>Every call opens its own handle, and mutations run in their own
 * transaction, so one instance is shared by all ingestion workers.
 * {@code total_files} and {@code total_flagged} are only ever written by
 * {@link #recountCaseStatistics}.
 */
@ApplicationScoped
public class CaseRepository {

    private static final Logger log = Logger.getLogger(CaseRepository.class);

    @Inject
    DatabaseService database;

    /**
     * @throws DuplicateCaseNumberException if the number is taken; the
     *                                      existing case is left untouched
     */
    public long createCase(NewCase newCase) {
        try {
            long caseId = database.jdbi().inTransaction(handle ->
                    handle.attach(CaseDao.class).insert(newCase));
            log.infof("Created case %d (%s)", caseId, newCase.caseNumber());
            return caseId;
        } catch (RuntimeException e) {
            if (SqlStates.isUniqueViolation(e)) {
                throw new DuplicateCaseNumberException(newCase.caseNumber(), e);
            }
            throw e;
        }
    }

    public Optional<CaseRecord> getCase(long caseId) {
        return database.jdbi().withExtension(CaseDao.class, dao -> dao.findById(caseId));
    }

    /** @throws CaseNotFoundException if no such case exists */
    public CaseRecord requireCase(long caseId) {
        return getCase(caseId).orElseThrow(() -> new CaseNotFoundException(caseId));
    }

    public Optional<CaseRecord> getCaseByNumber(String caseNumber) {
        return database.jdbi().withExtension(CaseDao.class, dao -> dao.findByNumber(caseNumber));
    }

    /** All cases, newest first. */
    public List<CaseRecord> getAllCases() {
        return database.jdbi().withExtension(CaseDao.class, CaseDao::findAll);
    }

    /** Cases in {@code status}, or all cases when it is null. */
    public List<CaseRecord> getAllCases(CaseStatus status) {
        if (status == null) {
            return getAllCases();
        }
        return database.jdbi().withExtension(CaseDao.class, dao -> dao.findByStatus(status));
    }

    /** Highest case number starting with {@code prefix}. */
    public Optional<String> lastCaseNumber(String prefix) {
        String pattern = escapeLike(prefix);
        return database.jdbi().withExtension(CaseDao.class, dao -> dao.findLastNumberWithPrefix(pattern));
    }

    static String escapeLike(String literal) {
        return literal.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * Applies the non-null fields of {@code update} and touches
     * {@code last_modified}.
     *
     * @return false when there was nothing to change or no such case
     */
    public boolean updateCase(long caseId, CaseUpdate update) {
        if (update.isEmpty()) {
            return false;
        }
        int rows = database.jdbi().inTransaction(handle ->
                handle.attach(CaseDao.class).update(caseId, update));
        return rows > 0;
    }

    /**
     * Recomputes {@code total_files} and {@code total_flagged} from the
     * evidence rows. Running it twice gives the same result.
     */
    public void recountCaseStatistics(long caseId) {
        int rows = database.jdbi().inTransaction(handle ->
                handle.attach(CaseDao.class).recount(caseId));
        if (rows == 0) {
            throw new CaseNotFoundException(caseId);
        }
        log.debugf("Recounted statistics for case %d", caseId);
    }

    public CaseStatisticsRecord getCaseStatistics(long caseId) {
        return database.jdbi().withExtension(CaseDao.class, dao -> dao.statistics(caseId));
    }
}
