package com.evidex.test;

import com.evidex.core.analysis.AnalysisFailureException;
import com.evidex.core.analysis.AnalysisResult;
import com.evidex.core.analysis.AnalysisService;
import com.evidex.core.analysis.AnalysisSummary;
import com.evidex.core.analysis.AnalyzerRegistry;
import com.evidex.core.analysis.FileAnalyzer;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.core.ingest.EvidenceRows;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditEntry;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.types.EvidenceCategory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class AnalysisServiceTest {

    @Inject
    AnalysisService analysisService;

    @Inject
    AnalyzerRegistry analyzerRegistry;

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    AuditRepository auditRepository;

    @Inject
    TestCases testCases;

    @TempDir
    Path tempDir;

    long caseId;

    @BeforeEach
    void setUp() {
        caseId = testCases.newCase("Analysis");
    }

    @Test
    void registryDiscoversAnalyzerBeans() {
        assertThat(analyzerRegistry.all()).extracting(FileAnalyzer::name)
                .containsExactly("test-faces", "test-ocr");
        assertThat(analyzerRegistry.forCategory(EvidenceCategory.AUDIO)).isEmpty();
    }

    @Test
    void analyzesQueueAndStoresResults() throws Exception {
        long doc = add("memo.txt", "meet at the pier", EvidenceCategory.DOCUMENT);
        long photo = add("group.jpg", "face:a face:b", EvidenceCategory.IMAGE);
        long audio = add("call.mp3", "audio", EvidenceCategory.AUDIO);

        AnalysisSummary summary = analysisService.analyzeCase(caseId, null);

        assertThat(summary.queued()).isEqualTo(3);
        assertThat(summary.analyzed()).isEqualTo(3);
        assertThat(summary.failed()).isZero();
        assertThat(summary.cancelled()).isFalse();

        EvidenceFileRecord memo = fileRepository.requireFile(doc);
        assertThat(memo.aiProcessed()).isTrue();
        assertThat(memo.ocrText()).isEqualTo("meet at the pier");
        assertThat(memo.aiTags()).isEqualTo("[\"document\"]");
        assertThat(memo.analyzedDate()).isNotNull();

        EvidenceFileRecord group = fileRepository.requireFile(photo);
        assertThat(group.faceCount()).isEqualTo(2);
        assertThat(group.aiConfidence()).isEqualTo(0.75);

        EvidenceFileRecord call = fileRepository.requireFile(audio);
        assertThat(call.aiProcessed()).isTrue();
        assertThat(call.aiTags()).isNull();

        assertThat(fileRepository.getUnprocessedCount(caseId)).isZero();
        assertThat(caseRepository.getCaseStatistics(caseId).totalFaces()).isEqualTo(2);
    }

    @Test
    void failingFileStaysQueuedAndRunContinues() throws Exception {
        long broken = add("broken.jpg", "corrupt header", EvidenceCategory.IMAGE);
        long fine = add("fine.jpg", "face:x", EvidenceCategory.IMAGE);

        AnalysisSummary summary = analysisService.analyzeCase(caseId, null);

        assertThat(summary.analyzed()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(fileRepository.requireFile(broken).aiProcessed()).isFalse();
        assertThat(fileRepository.requireFile(fine).aiProcessed()).isTrue();
        assertThat(fileRepository.getUnprocessedFiles(caseId)).extracting(EvidenceFileRecord::fileId)
                .containsExactly(broken);

        AuditEntry audit = auditRepository.getCaseLogs(caseId, 5).stream()
                .filter(e -> e.action().equals(AuditActions.ANALYZE_CASE))
                .findFirst().orElseThrow();
        assertThat(audit.details()).containsEntry("failed", 1).containsEntry("analyzed", 1);
    }

    @Test
    void unreadableContainerFailsItsFilesAndRunContinues() throws Exception {
        Path container = Files.writeString(tempDir.resolve("evidence.dat"), "plain text, not a container");
        long packed = addPacked(container, "DCIM/a.jpg", EvidenceCategory.IMAGE);
        long fine = add("fine.jpg", "face:x", EvidenceCategory.IMAGE);

        AnalysisSummary summary = analysisService.analyzeCase(caseId, null);

        assertThat(summary.queued()).isEqualTo(2);
        assertThat(summary.analyzed()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.cancelled()).isFalse();
        assertThat(fileRepository.requireFile(packed).aiProcessed()).isFalse();
        assertThat(fileRepository.requireFile(fine).aiProcessed()).isTrue();
        assertThat(auditRepository.getLogsByAction(AuditActions.ANALYZE_CASE, 20))
                .anySatisfy(e -> {
                    assertThat(e.caseId()).isEqualTo(caseId);
                    assertThat(e.details()).containsEntry("failed", 1).containsEntry("analyzed", 1);
                });
    }

    @Test
    void packedFilesAreAnalyzedFromTheirContainer() throws Exception {
        Path container = new TestZipBuilder()
                .addFile("DCIM/one.jpg", "face:a")
                .addFile("DCIM/two.jpg", "face:a face:b face:c")
                .addFile("Documents/bad.jpg", "corrupt")
                .addFile("Documents/note.txt", "packed note")
                .writeTo(tempDir.resolve("phone.zip"));
        long one = addPacked(container, "DCIM/one.jpg", EvidenceCategory.IMAGE);
        long two = addPacked(container, "DCIM/two.jpg", EvidenceCategory.IMAGE);
        long bad = addPacked(container, "Documents/bad.jpg", EvidenceCategory.IMAGE);
        long note = addPacked(container, "Documents/note.txt", EvidenceCategory.DOCUMENT);
        long gone = addPacked(container, "Documents/missing.txt", EvidenceCategory.DOCUMENT);

        var progress = new ArrayList<Integer>();
        AnalysisSummary summary = analysisService.analyzeCase(caseId, (current, total, message) -> progress.add(current));

        assertThat(summary.analyzed()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(progress).containsExactly(1, 2, 3, 4, 5);
        assertThat(fileRepository.requireFile(one).faceCount()).isEqualTo(1);
        assertThat(fileRepository.requireFile(two).faceCount()).isEqualTo(3);
        assertThat(fileRepository.requireFile(note).ocrText()).isEqualTo("packed note");
        assertThat(fileRepository.getUnprocessedFiles(caseId)).extracting(EvidenceFileRecord::fileId)
                .containsExactlyInAnyOrder(bad, gone);
    }

    @Test
    void secondRunOnlyTouchesUnprocessedFiles() throws Exception {
        add("once.txt", "text", EvidenceCategory.DOCUMENT);
        analysisService.analyzeCase(caseId, null);

        AnalysisSummary again = analysisService.analyzeCase(caseId, null);

        assertThat(again.queued()).isZero();
    }

    @Test
    void singleFileFailureIsReported() throws Exception {
        long broken = add("bad.jpg", "corrupt", EvidenceCategory.IMAGE);

        assertThatThrownBy(() -> analysisService.analyzeFile(broken))
                .isInstanceOf(AnalysisFailureException.class)
                .hasMessageContaining("test-faces");
    }

    @Test
    void singleFileAnalysisReturnsMergedResult() throws Exception {
        long doc = add("letter.txt", "hello", EvidenceCategory.DOCUMENT);

        AnalysisResult result = analysisService.analyzeFile(doc);

        assertThat(result.tags()).containsExactly("document");
        assertThat(result.text()).isEqualTo("hello");
    }

    private long addPacked(Path container, String entry, EvidenceCategory type) {
        String name = entry.substring(entry.lastIndexOf('/') + 1);
        String archive = container.toString();
        return fileRepository.addFile(new NewEvidenceFile(caseId, EvidenceRows.containerPath(archive, entry),
                entry, name, type, null, null, archive,
                null, null, null, null, null, null, null, null, null));
    }

    private long add(String name, String content, EvidenceCategory type) throws Exception {
        Path file = Files.writeString(tempDir.resolve(name), content);
        return fileRepository.addFile(NewEvidenceFile.of(caseId, file.toString(), name, type));
    }
}
