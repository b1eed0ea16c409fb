package com.evidex.core.cases;

import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseUpdate;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.dao.NewCase;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseNotFoundException;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.DuplicateCaseNumberException;
import com.evidex.core.repository.FileRepository;
import com.evidex.types.CaseStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Case lifecycle with an audit entry for every change.
 */
@ApplicationScoped
public class CaseManager {

    private static final Logger log = Logger.getLogger(CaseManager.class);
    private static final int RECENT_FILES = 10;
    private static final int NUMBER_ATTEMPTS = 5;

    @Inject
    CaseRepository caseRepository;

    @Inject
    FileRepository fileRepository;

    @Inject
    AuditRepository auditRepository;

    @ConfigProperty(name = "evidex.case-number.prefix", defaultValue = "CASE")
    String numberPrefix;

    Clock clock = Clock.systemDefaultZone();

    /**
     * Creates a case. A blank case number is replaced by the next
     * {@code <prefix>-<year>-<NNNN>} number.
     *
     * @throws DuplicateCaseNumberException if an explicit number is taken
     */
    public CaseRecord createCase(NewCase newCase) {
        boolean generated = newCase.caseNumber().isBlank();
        int attempts = generated ? NUMBER_ATTEMPTS : 1;
        for (int attempt = 1; ; attempt++) {
            NewCase toInsert = generated ? newCase.withCaseNumber(nextCaseNumber()) : newCase;
            try {
                long caseId = caseRepository.createCase(toInsert);
                auditRepository.log(AuditActions.CREATE_CASE, caseId,
                        Map.of("case_number", toInsert.caseNumber()));
                return caseRepository.requireCase(caseId);
            } catch (DuplicateCaseNumberException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                log.debugf("Generated case number %s was taken, retrying", toInsert.caseNumber());
            }
        }
    }

    /** Looks the case up and records that it was opened. */
    public Optional<CaseRecord> openCase(long caseId) {
        Optional<CaseRecord> found = caseRepository.getCase(caseId);
        found.ifPresent(c -> auditRepository.log(AuditActions.OPEN_CASE, caseId, Map.of()));
        return found;
    }

    public CaseRecord closeCase(long caseId) {
        return changeStatus(caseId, CaseStatus.CLOSED, AuditActions.CLOSE_CASE);
    }

    public CaseRecord reopenCase(long caseId) {
        return changeStatus(caseId, CaseStatus.OPEN, AuditActions.OPEN_CASE);
    }

    /**
     * Applies the non-null fields of {@code update}.
     *
     * @throws CaseNotFoundException if no such case exists
     */
    public CaseRecord updateCase(long caseId, CaseUpdate update) {
        caseRepository.requireCase(caseId);
        if (caseRepository.updateCase(caseId, update)) {
            auditRepository.log(AuditActions.UPDATE_CASE, caseId, changedFields(update));
        }
        return caseRepository.requireCase(caseId);
    }

    public List<CaseRecord> listCases(CaseStatus status) {
        return caseRepository.getAllCases(status);
    }

    public CaseSummary summary(long caseId) {
        CaseRecord record = caseRepository.requireCase(caseId);
        List<EvidenceFileRecord> files = fileRepository.getFilesByCase(caseId, false);
        return new CaseSummary(
                record,
                caseRepository.getCaseStatistics(caseId),
                fileRepository.countByCategory(caseId),
                files.subList(0, Math.min(RECENT_FILES, files.size())),
                fileRepository.getFilesByCase(caseId, true));
    }

    /** Flags a file and refreshes its case's counters. */
    public EvidenceFileRecord flagFile(long fileId, String reason) {
        EvidenceFileRecord file = fileRepository.requireFile(fileId);
        fileRepository.flag(fileId, reason);
        caseRepository.recountCaseStatistics(file.caseId());
        auditRepository.log(AuditActions.FLAG_FILE, file.caseId(),
                Map.of("file_id", fileId, "reason", reason == null ? "" : reason));
        return fileRepository.requireFile(fileId);
    }

    /** Clears a file's flag and refreshes its case's counters. */
    public EvidenceFileRecord unflagFile(long fileId) {
        EvidenceFileRecord file = fileRepository.requireFile(fileId);
        fileRepository.unflag(fileId);
        caseRepository.recountCaseStatistics(file.caseId());
        auditRepository.log(AuditActions.UNFLAG_FILE, file.caseId(), Map.of("file_id", fileId));
        return fileRepository.requireFile(fileId);
    }

    String nextCaseNumber() {
        String yearPrefix = numberPrefix + "-" + Year.now(clock).getValue() + "-";
        int next = caseRepository.lastCaseNumber(yearPrefix)
                .map(last -> parseSequence(last, yearPrefix) + 1)
                .orElse(1);
        return yearPrefix + String.format("%04d", next);
    }

    private static int parseSequence(String caseNumber, String yearPrefix) {
        try {
            return Integer.parseInt(caseNumber.substring(yearPrefix.length()));
        } catch (NumberFormatException e) {
            // hand-entered number sharing the prefix
            return 0;
        }
    }

    private CaseRecord changeStatus(long caseId, CaseStatus status, String action) {
        if (!caseRepository.updateCase(caseId, CaseUpdate.status(status))) {
            throw new CaseNotFoundException(caseId);
        }
        auditRepository.log(action, caseId, Map.of());
        return caseRepository.requireCase(caseId);
    }

    private static Map<String, Object> changedFields(CaseUpdate update) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfSet(fields, "case_name", update.caseName());
        putIfSet(fields, "investigator_name", update.investigatorName());
        putIfSet(fields, "agency_name", update.agencyName());
        putIfSet(fields, "incident_date", update.incidentDate() == null ? null : update.incidentDate().toString());
        putIfSet(fields, "status", update.status() == null ? null : update.status().label());
        putIfSet(fields, "notes", update.notes());
        putIfSet(fields, "evidence_source_path", update.evidenceSourcePath());
        return fields;
    }

    private static void putIfSet(Map<String, Object> fields, String key, Object value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
