package com.evidex.test;

import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.ingest.CancellationToken;
import com.evidex.core.ingest.IngestionCompletedEvent;
import com.evidex.core.ingest.IngestionService;
import com.evidex.core.ingest.IngestionStats;
import com.evidex.core.repository.AuditActions;
import com.evidex.core.repository.AuditEntry;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseNotFoundException;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.UnsupportedFormatException;
import com.evidex.types.EvidenceCategory;
import com.evidex.types.ExtractionFormat;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
@Timeout(120)
class IngestionServiceTest {

    @Inject
    IngestionService ingestionService;

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    AuditRepository auditRepository;

    @Inject
    TestCases testCases;

    @Inject
    CompletionCollector completions;

    @TempDir
    Path tempDir;

    long caseId;

    @BeforeEach
    void setUp() {
        caseId = testCases.newCase("Ingestion");
        completions.clear();
    }

    @Test
    void indexesZipEntriesAsContainerRows() throws Exception {
        Path zip = new TestZipBuilder()
                .addDirectory("DCIM")
                .addFile("DCIM/IMG_0001.jpg", "jpeg bytes")
                .addFile("Documents/report.pdf", "pdf bytes")
                .addFile("notes.txt", "hello")
                .writeTo(tempDir.resolve("phone.zip"));

        IngestionStats stats = ingestionService.ingest(zip, caseId);

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.processed()).isEqualTo(3);
        assertThat(stats.errors()).isZero();
        assertThat(stats.cancelled()).isFalse();
        assertThat(stats.format()).isEqualTo(ExtractionFormat.ZIP_ARCHIVE);
        assertThat(stats.count(EvidenceCategory.IMAGE)).isEqualTo(1);

        List<EvidenceFileRecord> files = fileRepository.getFilesByCase(caseId);
        String archive = zip.toAbsolutePath().toString();
        assertThat(files).extracting(EvidenceFileRecord::filePath)
                .containsExactlyInAnyOrder(archive + "!/DCIM/IMG_0001.jpg",
                        archive + "!/Documents/report.pdf", archive + "!/notes.txt");
        assertThat(files).extracting(EvidenceFileRecord::sourceArchive).containsOnly(archive);

        CaseRecord record = caseRepository.requireCase(caseId);
        assertThat(record.totalFiles()).isEqualTo(3);
        assertThat(record.evidenceSourcePath()).isEqualTo(archive);
    }

    @Test
    void everyEntryOfLargeExtractionIsAccountedFor() throws Exception {
        TestZipBuilder builder = new TestZipBuilder();
        for (int i = 0; i < 5000; i++) {
            builder.addFile("chats/msg-" + i + ".txt", "message " + i);
        }
        Path zip = builder.writeTo(tempDir.resolve("bulk.zip"));

        IngestionStats stats = ingestionService.ingest(zip, caseId, 8, null);

        assertThat(stats.total()).isEqualTo(5000);
        assertThat(stats.processed() + stats.errors()).isEqualTo(stats.total());
        assertThat(stats.processed()).isEqualTo(5000);
        assertThat(stats.filesPerSecond()).isPositive();
        assertThat(caseRepository.requireCase(caseId).totalFiles()).isEqualTo(5000);
    }

    @Test
    void indexingCostFollowsEntryCountNotContentSize() throws Exception {
        TestZipBuilder tiny = new TestZipBuilder();
        for (int i = 0; i < 500; i++) {
            tiny.addFile("tiny/" + i + ".txt", "t");
        }
        TestZipBuilder large = new TestZipBuilder();
        byte[] blob = new byte[8 * 1024 * 1024];
        for (int i = 0; i < 5; i++) {
            large.addFile("video/clip-" + i + ".mp4", blob);
        }
        long largeCase = testCases.newCase("Large files");

        IngestionStats tinyStats = ingestionService.ingest(tiny.writeTo(tempDir.resolve("tiny.zip")), caseId, 4, null);
        IngestionStats largeStats = ingestionService.ingest(large.writeTo(tempDir.resolve("large.zip")), largeCase, 4, null);

        assertThat(tinyStats.processed()).isEqualTo(500);
        assertThat(largeStats.processed()).isEqualTo(5);
        assertThat(largeStats.count(EvidenceCategory.VIDEO)).isEqualTo(5);
        // 40 MB of content must not cost more than 500 inserts
        assertThat(largeStats.elapsedSeconds()).isLessThan(tinyStats.elapsedSeconds() + 2.0);
        assertThat(fileRepository.getFilesByCase(largeCase)).extracting(EvidenceFileRecord::fileSize)
                .containsOnly((long) blob.length);
    }

    @Test
    void progressIsMonotonicAndEndsAtCompletion() throws Exception {
        TestZipBuilder builder = new TestZipBuilder();
        for (int i = 0; i < 200; i++) {
            builder.addFile("f" + i + ".txt", "x");
        }
        Path zip = builder.writeTo(tempDir.resolve("progress.zip"));
        List<Integer> values = Collections.synchronizedList(new ArrayList<>());
        List<String> messages = Collections.synchronizedList(new ArrayList<>());

        ingestionService.ingest(zip, caseId, 4, (current, total, message) -> {
            values.add(current);
            messages.add(message);
        });

        assertThat(values).isSorted();
        assertThat(values.get(values.size() - 1)).isEqualTo(100);
        assertThat(messages.get(messages.size() - 1)).startsWith("Complete! Processed 200 files in");
    }

    @Test
    void unsupportedFormatWritesNothing() throws Exception {
        Path blob = tempDir.resolve("unknown.dat");
        Files.writeString(blob, "plain text that is no container", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> ingestionService.ingest(blob, caseId))
                .isInstanceOf(UnsupportedFormatException.class);

        assertThat(fileRepository.getFilesByCase(caseId)).isEmpty();
        assertThat(auditRepository.getCaseLogs(caseId, 10))
                .extracting(AuditEntry::action)
                .doesNotContain(AuditActions.IMPORT_EXTRACTION);
        assertThat(completions.events()).isEmpty();
    }

    @Test
    void unknownCaseIsRejectedBeforeReading() throws Exception {
        Path zip = new TestZipBuilder().addFile("a.txt", "a").writeTo(tempDir.resolve("a.zip"));

        assertThatThrownBy(() -> ingestionService.ingest(zip, Long.MAX_VALUE))
                .isInstanceOf(CaseNotFoundException.class);
    }

    @Test
    void invalidWorkerCountIsRejectedBeforeIndexing() throws Exception {
        Path zip = new TestZipBuilder().addFile("a.txt", "a").writeTo(tempDir.resolve("workers.zip"));
        List<String> messages = new ArrayList<>();

        assertThatThrownBy(() -> ingestionService.ingest(zip, caseId, 0, (c, t, m) -> messages.add(m)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerCount");
        assertThatThrownBy(() -> ingestionService.importDirectory(tempDir, caseId, -1, null, null))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(messages).isEmpty();
        assertThat(fileRepository.getFilesByCase(caseId)).isEmpty();
    }

    @Test
    void cancelledRunSkipsRemainingItems() throws Exception {
        TestZipBuilder builder = new TestZipBuilder();
        for (int i = 0; i < 50; i++) {
            builder.addFile("c" + i + ".txt", "x");
        }
        Path zip = builder.writeTo(tempDir.resolve("cancel.zip"));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        IngestionStats stats = ingestionService.ingest(zip, caseId, 2, null, token);

        assertThat(stats.cancelled()).isTrue();
        assertThat(stats.processed()).isZero();
        assertThat(stats.skipped()).isEqualTo(50);
        assertThat(fileRepository.getFilesByCase(caseId)).isEmpty();
    }

    @Test
    void completionIsAuditedAndAnnounced() throws Exception {
        Path zip = new TestZipBuilder()
                .addFile("a.txt", "a")
                .addFile("b.txt", "b")
                .writeTo(tempDir.resolve("audit.zip"));

        ingestionService.ingest(zip, caseId);

        List<AuditEntry> logs = auditRepository.getCaseLogs(caseId, 10);
        AuditEntry entry = logs.stream()
                .filter(e -> e.action().equals(AuditActions.IMPORT_EXTRACTION))
                .findFirst().orElseThrow();
        assertThat(entry.details())
                .containsEntry("mode", "index")
                .containsEntry("format", "zip_archive")
                .containsEntry("processed", 2);
        assertThat(completions.events())
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.caseId()).isEqualTo(caseId);
                    assertThat(e.stats().processed()).isEqualTo(2);
                });
    }

    @Test
    void fullExtractionImportsExtractedFiles() throws Exception {
        Path zip = new TestZipBuilder()
                .addFile("keep/photo.jpg", "jpeg")
                .addFile("keep/letter.txt", "dear")
                .addFile("skip/cache.bin", "junk")
                .writeTo(tempDir.resolve("full.zip"));
        Path target = tempDir.resolve("extracted");

        IngestionStats stats = ingestionService.ingestWithFullExtraction(zip, caseId, target,
                entry -> entry.startsWith("keep/"), 2, null, null);

        assertThat(stats.processed()).isEqualTo(2);
        assertThat(Files.exists(target.resolve("keep/photo.jpg"))).isTrue();
        assertThat(Files.exists(target.resolve("skip/cache.bin"))).isFalse();

        List<EvidenceFileRecord> files = fileRepository.getFilesByCase(caseId);
        assertThat(files).extracting(EvidenceFileRecord::fileRelativePath)
                .containsExactlyInAnyOrder("keep/photo.jpg", "keep/letter.txt");
        assertThat(files).allSatisfy(f -> {
            assertThat(Files.isRegularFile(Path.of(f.filePath()))).isTrue();
            assertThat(f.sourceArchive()).isEqualTo(zip.toAbsolutePath().toString());
        });
    }

    @Test
    void directoryImportWalksTree() throws Exception {
        Path root = tempDir.resolve("tree");
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("top.pdf"), "pdf");
        Files.writeString(root.resolve("sub/clip.mp4"), "mp4");

        IngestionStats stats = ingestionService.importDirectory(root, caseId, 2, null, null);

        assertThat(stats.processed()).isEqualTo(2);
        assertThat(stats.count(EvidenceCategory.DOCUMENT)).isEqualTo(1);
        assertThat(stats.count(EvidenceCategory.VIDEO)).isEqualTo(1);
        assertThat(fileRepository.getFilesByCase(caseId))
                .extracting(EvidenceFileRecord::fileRelativePath)
                .containsExactlyInAnyOrder("top.pdf", "sub/clip.mp4");
        assertThat(auditRepository.getCaseLogs(caseId, 10))
                .extracting(AuditEntry::action)
                .contains(AuditActions.IMPORT_DIRECTORY);
    }

    @ApplicationScoped
    public static class CompletionCollector {

        private final List<IngestionCompletedEvent> events = new CopyOnWriteArrayList<>();

        void onCompleted(@Observes IngestionCompletedEvent event) {
            events.add(event);
        }

        List<IngestionCompletedEvent> events() {
            return List.copyOf(events);
        }

        void clear() {
            events.clear();
        }
    }
}
