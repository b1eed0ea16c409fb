package com.evidex.test;

import com.evidex.core.dao.AnalysisUpdate;
import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseStatisticsRecord;
import com.evidex.core.dao.CaseUpdate;
import com.evidex.core.dao.NewCase;
import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.core.repository.CaseNotFoundException;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.DuplicateCaseNumberException;
import com.evidex.core.repository.FileRepository;
import com.evidex.types.CaseStatus;
import com.evidex.types.EvidenceCategory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class CaseRepositoryTest {

    @Inject
    CaseRepository caseRepository;

    @Inject
    FileRepository fileRepository;

    @Test
    void createdCaseStartsOpenWithZeroCounts() {
        String number = TestCases.uniqueNumber();
        long caseId = caseRepository.createCase(new NewCase(number, "Harbor burglary",
                "Det. Ruiz", "Metro PD", LocalDate.of(2024, 3, 14), "initial notes"));

        CaseRecord record = caseRepository.requireCase(caseId);
        assertThat(record.caseNumber()).isEqualTo(number);
        assertThat(record.caseName()).isEqualTo("Harbor burglary");
        assertThat(record.incidentDate()).isEqualTo(LocalDate.of(2024, 3, 14));
        assertThat(record.status()).isEqualTo(CaseStatus.OPEN);
        assertThat(record.totalFiles()).isZero();
        assertThat(record.totalFlagged()).isZero();
        assertThat(record.createdDate()).isNotNull();
        assertThat(caseRepository.getCaseByNumber(number)).map(CaseRecord::caseId).contains(caseId);
    }

    @Test
    void duplicateCaseNumberIsRejectedAndFirstCaseIsIntact() {
        String number = TestCases.uniqueNumber();
        long first = caseRepository.createCase(new NewCase(number, "First", null, null, null, null));

        assertThatThrownBy(() -> caseRepository.createCase(
                new NewCase(number, "Second", null, null, null, null)))
                .isInstanceOf(DuplicateCaseNumberException.class)
                .hasMessageContaining(number);

        assertThat(caseRepository.requireCase(first).caseName()).isEqualTo("First");
        assertThat(caseRepository.getAllCases())
                .filteredOn(c -> c.caseNumber().equals(number))
                .hasSize(1);
    }

    @Test
    void updateLeavesNullFieldsUnchanged() {
        long caseId = caseRepository.createCase(new NewCase(TestCases.uniqueNumber(), "Original",
                "Det. Ruiz", null, null, "keep me"));

        boolean changed = caseRepository.updateCase(caseId, CaseUpdate.status(CaseStatus.CLOSED));

        CaseRecord record = caseRepository.requireCase(caseId);
        assertThat(changed).isTrue();
        assertThat(record.status()).isEqualTo(CaseStatus.CLOSED);
        assertThat(record.caseName()).isEqualTo("Original");
        assertThat(record.investigatorName()).isEqualTo("Det. Ruiz");
        assertThat(record.notes()).isEqualTo("keep me");
        assertThat(caseRepository.getAllCases(CaseStatus.CLOSED))
                .extracting(CaseRecord::caseId).contains(caseId);
        assertThat(caseRepository.getAllCases(CaseStatus.OPEN))
                .extracting(CaseRecord::caseId).doesNotContain(caseId);
    }

    @Test
    void updatingMissingCaseReportsNoChange() {
        assertThat(caseRepository.updateCase(Long.MAX_VALUE, CaseUpdate.status(CaseStatus.CLOSED))).isFalse();
        assertThat(caseRepository.getCase(Long.MAX_VALUE)).isEmpty();
        assertThatThrownBy(() -> caseRepository.requireCase(Long.MAX_VALUE))
                .isInstanceOf(CaseNotFoundException.class);
    }

    @Test
    void recountIsIdempotentAndMatchesRows() {
        long caseId = caseRepository.createCase(new NewCase(TestCases.uniqueNumber(), "Counts",
                null, null, null, null));
        long a = fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/a.jpg", "a.jpg", EvidenceCategory.IMAGE));
        fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/b.txt", "b.txt", EvidenceCategory.DOCUMENT));
        fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/c.txt", "c.txt", EvidenceCategory.DOCUMENT));
        fileRepository.flag(a, "relevant");

        caseRepository.recountCaseStatistics(caseId);
        CaseRecord once = caseRepository.requireCase(caseId);
        caseRepository.recountCaseStatistics(caseId);
        CaseRecord twice = caseRepository.requireCase(caseId);

        assertThat(once.totalFiles()).isEqualTo(3);
        assertThat(once.totalFlagged()).isEqualTo(1);
        assertThat(twice.totalFiles()).isEqualTo(once.totalFiles());
        assertThat(twice.totalFlagged()).isEqualTo(once.totalFlagged());
    }

    @Test
    void recountOfMissingCaseFails() {
        assertThatThrownBy(() -> caseRepository.recountCaseStatistics(Long.MAX_VALUE))
                .isInstanceOf(CaseNotFoundException.class);
    }

    @Test
    void statisticsCountAnalysisOutcomes() {
        long caseId = caseRepository.createCase(new NewCase(TestCases.uniqueNumber(), "Stats",
                null, null, null, null));
        long img = fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/p.jpg", "p.jpg", EvidenceCategory.IMAGE));
        fileRepository.addFile(NewEvidenceFile.of(caseId, "/e/q.jpg", "q.jpg", EvidenceCategory.IMAGE));
        fileRepository.updateAnalysis(img, new AnalysisUpdate(null, 0.9, null, 2));

        CaseStatisticsRecord stats = caseRepository.getCaseStatistics(caseId);

        assertThat(stats.totalFiles()).isEqualTo(2);
        assertThat(stats.processedFiles()).isEqualTo(1);
        assertThat(stats.filesWithFaces()).isEqualTo(1);
        assertThat(stats.totalFaces()).isEqualTo(2);
        assertThat(stats.flaggedFiles()).isZero();
    }

    @Test
    void lastCaseNumberFindsHighestWithPrefix() {
        String prefix = "SEQ" + TestCases.uniqueNumber().substring(5) + "-2024-";
        caseRepository.createCase(new NewCase(prefix + "0002", "b", null, null, null, null));
        caseRepository.createCase(new NewCase(prefix + "0010", "c", null, null, null, null));
        caseRepository.createCase(new NewCase(prefix + "0001", "a", null, null, null, null));

        assertThat(caseRepository.lastCaseNumber(prefix)).contains(prefix + "0010");
        assertThat(caseRepository.lastCaseNumber("NOPE-")).isEmpty();
    }

    @Test
    void lastCaseNumberTreatsWildcardsLiterally() {
        String base = "ESC" + TestCases.uniqueNumber().substring(5);
        caseRepository.createCase(new NewCase(base + "_2024-0003", "literal", null, null, null, null));
        caseRepository.createCase(new NewCase(base + "z2024-0099", "decoy", null, null, null, null));

        assertThat(caseRepository.lastCaseNumber(base + "_2024-")).contains(base + "_2024-0003");
        assertThat(caseRepository.lastCaseNumber(base + "%")).isEmpty();
    }
}
