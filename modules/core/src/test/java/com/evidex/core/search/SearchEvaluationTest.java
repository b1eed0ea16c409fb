package com.evidex.core.search;

import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.types.EvidenceCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SearchEvaluationTest {

    private ForensicSearchEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ForensicSearchEngine();
        engine.objectMapper = new ObjectMapper();
    }

    private static Instant localNoon(int year, int month, int day) {
        return LocalDateTime.of(year, month, day, 12, 0).atZone(ZoneId.systemDefault()).toInstant();
    }

    private static EvidenceFileRecord file(long id, String name, String ocr, String tags,
                                           Instant taken, Instant created, Instant modified) {
        return new EvidenceFileRecord(id, 1, "/e/" + name, name, name, EvidenceCategory.DOCUMENT, 10L, null, null,
                created, modified, null, taken, null, null, null, null, null, null,
                tags != null, tags, null, ocr, 0, false, null, null, Instant.now(), null);
    }

    @Test
    void identityMatchesFilenameAndContent() {
        EvidenceFileRecord f = file(1, "john_doe_passport.jpg", "Holder: JOHN DOE", null, null, null, null);

        ForensicSearchEngine.Accumulator acc = engine.evaluate(f,
                SearchCriteria.builder().identity("John_Doe").build());

        assertThat(acc.reasons).containsExactly("Name in filename: john_doe_passport.jpg");
        assertThat(acc.count).isEqualTo(1);

        acc = engine.evaluate(f, SearchCriteria.builder().identity("john doe").build());
        assertThat(acc.reasons).containsExactly("Name found in file content");
    }

    @Test
    void keywordCountsFilenameContentAndTagsOnce() {
        EvidenceFileRecord f = file(1, "Invoice_March.pdf", "invoice total 300",
                "[\"invoice\", \"invoice-paper\", \"document\"]", null, null, null);

        ForensicSearchEngine.Accumulator acc = engine.evaluate(f,
                SearchCriteria.builder().keyword("INVOICE").build());

        assertThat(acc.reasons).containsExactly(
                "Keyword 'INVOICE' in filename",
                "Keyword 'INVOICE' in content",
                "Keyword 'INVOICE' in AI tags");
        assertThat(acc.count).isEqualTo(3);
    }

    @Test
    void unreadableTagsAreIgnored() {
        EvidenceFileRecord f = file(1, "a.txt", null, "not json [", null, null, null);

        assertThat(engine.evaluate(f, SearchCriteria.builder().keyword("json").build()).count).isZero();
    }

    @Test
    void dateRangeIsInclusiveByDayAndFallsBack() {
        DateRange march = DateRange.between(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));
        SearchCriteria criteria = SearchCriteria.builder().dateRange(march).build();

        assertThat(engine.evaluate(file(1, "a", null, null, localNoon(2024, 3, 31), null, null), criteria).reasons)
                .containsExactly("File date within search range");
        assertThat(engine.evaluate(file(2, "b", null, null, null, localNoon(2024, 3, 1), null), criteria).count)
                .isEqualTo(1);
        assertThat(engine.evaluate(file(3, "c", null, null, null, null, localNoon(2024, 3, 15)), criteria).count)
                .isEqualTo(1);
        // taken date wins over a created date inside the range
        assertThat(engine.evaluate(file(4, "d", null, null, localNoon(2024, 4, 1), localNoon(2024, 3, 2), null),
                criteria).count).isZero();
        assertThat(engine.evaluate(file(5, "e", null, null, null, null, null), criteria).count).isZero();
    }

    @Test
    void nothingMatchesEmptyCriteria() {
        EvidenceFileRecord f = file(1, "anything.txt", "text", "[\"tag\"]", localNoon(2024, 1, 1), null, null);

        assertThat(engine.evaluate(f, SearchCriteria.builder().build()).count).isZero();
    }

    @Test
    void openEndedRange() {
        DateRange from = new DateRange(LocalDate.of(2024, 1, 1), null);

        assertThat(from.contains(LocalDate.of(2030, 1, 1))).isTrue();
        assertThat(from.contains(LocalDate.of(2023, 12, 31))).isFalse();
    }
}
