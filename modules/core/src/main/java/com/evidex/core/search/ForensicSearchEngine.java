package com.evidex.core.search;

import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.ProgressListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multi-criteria search over the files of a case.
 *
 * <p>Each matched criterion adds one to a file's match count and one
 * explanation: the identity in the file name and in extracted text, each
 * keyword in the file name, text and tags, and the file date within the
 * range. Files with at least one match are returned, most matches first;
 * ties keep case order. When a reference photo is given, a second pass over
 * the case's images adds or strengthens matches for recognised faces.
 */
@ApplicationScoped
public class ForensicSearchEngine {

    private static final Logger log = Logger.getLogger(ForensicSearchEngine.class);
    private static final Comparator<Accumulator> BY_COUNT =
            Comparator.comparingInt((Accumulator a) -> a.count).reversed();

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    PersonLocator personLocator;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Searches with the deployed identity matcher when the criteria carry a
     * reference image; without a deployed matcher the face pass is skipped.
     */
    public List<SearchMatch> search(long caseId, SearchCriteria criteria) {
        IdentityMatcher matcher = null;
        if (criteria.referenceImage() != null) {
            if (personLocator.matcherFactory().isPresent()) {
                matcher = personLocator.matcherFor(criteria.referenceImage());
            } else {
                log.warn("Reference image given but no identity matcher is deployed; skipping face matching");
            }
        }
        return search(caseId, criteria, matcher);
    }

    /**
     * Searches using an already loaded {@code matcher} (null for no face pass).
     */
    public List<SearchMatch> search(long caseId, SearchCriteria criteria, IdentityMatcher matcher) {
        caseRepository.requireCase(caseId);
        List<EvidenceFileRecord> files = fileRepository.getFilesByCase(caseId, criteria.fileTypes());
        log.debugf("Searching %d files of case %d", files.size(), caseId);

        Map<Long, Accumulator> matches = new LinkedHashMap<>();
        for (EvidenceFileRecord file : files) {
            Accumulator acc = evaluate(file, criteria);
            if (acc.count > 0) {
                matches.put(file.fileId(), acc);
            }
        }

        if (matcher != null) {
            for (FaceHit hit : personLocator.scan(caseId, matcher, ProgressListener.NONE)) {
                Accumulator acc = matches.computeIfAbsent(hit.file().fileId(), id -> new Accumulator(hit.file()));
                acc.add(PersonLocator.faceReason(hit.match()));
                acc.faceConfidence = acc.faceConfidence == null
                        ? hit.match().confidence()
                        : Math.max(acc.faceConfidence, hit.match().confidence());
            }
        }

        List<Accumulator> ranked = new ArrayList<>(matches.values());
        ranked.sort(BY_COUNT);
        log.infof("Search in case %d: %d of %d files matched", caseId, ranked.size(), files.size());
        return ranked.stream().map(Accumulator::toMatch).toList();
    }

    Accumulator evaluate(EvidenceFileRecord file, SearchCriteria criteria) {
        Accumulator acc = new Accumulator(file);
        String name = file.fileName();
        String text = file.ocrText();

        String identity = criteria.identity();
        if (identity != null) {
            if (containsIgnoreCase(name, identity)) {
                acc.add("Name in filename: " + name);
            }
            if (containsIgnoreCase(text, identity)) {
                acc.add("Name found in file content");
            }
        }

        if (!criteria.keywords().isEmpty()) {
            List<String> tags = parseTags(file);
            for (String keyword : criteria.keywords()) {
                if (containsIgnoreCase(name, keyword)) {
                    acc.add("Keyword '" + keyword + "' in filename");
                }
                if (containsIgnoreCase(text, keyword)) {
                    acc.add("Keyword '" + keyword + "' in content");
                }
                for (String tag : tags) {
                    if (containsIgnoreCase(tag, keyword)) {
                        acc.add("Keyword '" + keyword + "' in AI tags");
                        break;
                    }
                }
            }
        }

        if (criteria.dateRange() != null) {
            Instant date = file.effectiveDate();
            if (date != null && criteria.dateRange().contains(date.atZone(ZoneId.systemDefault()).toLocalDate())) {
                acc.add("File date within search range");
            }
        }
        return acc;
    }

    private List<String> parseTags(EvidenceFileRecord file) {
        String json = file.aiTags();
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isArray()) {
                return List.of(node.asText());
            }
            List<String> tags = new ArrayList<>();
            node.forEach(element -> tags.add(element.asText()));
            return tags;
        } catch (JsonProcessingException e) {
            log.debugf("Unreadable tags on file %d: %s", file.fileId(), e.getOriginalMessage());
            return List.of();
        }
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    static final class Accumulator {
        final EvidenceFileRecord file;
        final List<String> reasons = new ArrayList<>();
        int count;
        Double faceConfidence;

        Accumulator(EvidenceFileRecord file) {
            this.file = file;
        }

        void add(String reason) {
            reasons.add(reason);
            count++;
        }

        SearchMatch toMatch() {
            return new SearchMatch(file, reasons, count, faceConfidence);
        }
    }
}
