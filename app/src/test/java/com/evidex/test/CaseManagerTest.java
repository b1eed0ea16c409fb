package com.evidex.test;

import com.evidex.core.cases.CaseManager;
import com.evidex.core.cases.CaseSummary;
import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseUpdate;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.dao.NewCase;
import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditEntry;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.types.CaseStatus;
import com.evidex.types.EvidenceCategory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Year;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class CaseManagerTest {

    @Inject
    CaseManager caseManager;

    @Inject
    FileRepository fileRepository;

    @Inject
    AuditRepository auditRepository;

    @Test
    void blankNumberIsGeneratedInSequence() {
        CaseRecord first = caseManager.createCase(new NewCase("", "Generated A", null, null, null, null));
        CaseRecord second = caseManager.createCase(new NewCase(" ", "Generated B", null, null, null, null));

        String yearPrefix = "CASE-" + Year.now().getValue() + "-";
        assertThat(first.caseNumber()).startsWith(yearPrefix).matches("CASE-\\d{4}-\\d{4}");
        int a = Integer.parseInt(first.caseNumber().substring(yearPrefix.length()));
        int b = Integer.parseInt(second.caseNumber().substring(yearPrefix.length()));
        assertThat(b).isEqualTo(a + 1);
    }

    @Test
    void creationIsAudited() {
        CaseRecord created = caseManager.createCase(new NewCase(TestCases.uniqueNumber(), "Audited",
                null, null, null, null));

        List<AuditEntry> logs = auditRepository.getCaseLogs(created.caseId(), 10);
        assertThat(logs).extracting(AuditEntry::action).containsExactly(AuditActions.CREATE_CASE);
        assertThat(logs.get(0).details()).containsEntry("case_number", created.caseNumber());
        assertThat(logs.get(0).userName()).isEqualTo("System");
    }

    @Test
    void closeAndReopenChangeStatus() {
        CaseRecord created = caseManager.createCase(new NewCase(TestCases.uniqueNumber(), "Lifecycle",
                null, null, null, null));

        assertThat(caseManager.closeCase(created.caseId()).status()).isEqualTo(CaseStatus.CLOSED);
        assertThat(caseManager.reopenCase(created.caseId()).status()).isEqualTo(CaseStatus.OPEN);
        assertThat(auditRepository.getCaseLogs(created.caseId(), 10)).extracting(AuditEntry::action)
                .contains(AuditActions.CLOSE_CASE, AuditActions.OPEN_CASE);
    }

    @Test
    void updateAuditsChangedFieldsOnly() {
        CaseRecord created = caseManager.createCase(new NewCase(TestCases.uniqueNumber(), "Before",
                null, null, null, null));

        CaseRecord updated = caseManager.updateCase(created.caseId(), CaseUpdate.NONE.withNotes("new lead"));

        assertThat(updated.notes()).isEqualTo("new lead");
        assertThat(updated.caseName()).isEqualTo("Before");
        AuditEntry entry = auditRepository.getLogsByAction(AuditActions.UPDATE_CASE, 50).stream()
                .filter(e -> Long.valueOf(created.caseId()).equals(e.caseId()))
                .findFirst().orElseThrow();
        assertThat(entry.details()).containsOnlyKeys("notes");
    }

    @Test
    void flaggingRecountsAndSummarizes() {
        CaseRecord created = caseManager.createCase(new NewCase(TestCases.uniqueNumber(), "Summary",
                null, null, null, null));
        long caseId = created.caseId();
        long photo = fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/p.jpg", "p.jpg", EvidenceCategory.IMAGE));
        fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/q.pdf", "q.pdf", EvidenceCategory.DOCUMENT));

        EvidenceFileRecord flagged = caseManager.flagFile(photo, "suspect present");

        assertThat(flagged.flagged()).isTrue();
        CaseSummary summary = caseManager.summary(caseId);
        assertThat(summary.caseInfo().totalFlagged()).isEqualTo(1);
        assertThat(summary.caseInfo().totalFiles()).isEqualTo(2);
        assertThat(summary.flaggedFiles()).extracting(EvidenceFileRecord::fileId).containsExactly(photo);
        assertThat(summary.recentFiles()).hasSize(2);
        assertThat(summary.categories()).containsEntry(EvidenceCategory.IMAGE, 1L);

        caseManager.unflagFile(photo);

        assertThat(caseManager.summary(caseId).caseInfo().totalFlagged()).isZero();
        assertThat(auditRepository.getCaseLogs(caseId, 10)).extracting(AuditEntry::action)
                .contains(AuditActions.FLAG_FILE, AuditActions.UNFLAG_FILE);
    }

    @Test
    void openingMissingCaseIsEmpty() {
        assertThat(caseManager.openCase(Long.MAX_VALUE)).isEmpty();
    }
}
