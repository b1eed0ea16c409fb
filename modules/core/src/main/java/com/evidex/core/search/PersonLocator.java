package com.evidex.core.search;

import com.evidex.core.content.EvidenceContentResolver;
import com.evidex.core.content.LocalCopy;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.ProgressListener;
import com.evidex.types.EvidenceCategory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Finds a person across every image of a case by comparing each one with a
 * reference photo.
 */
@ApplicationScoped
public class PersonLocator {

    private static final Logger log = Logger.getLogger(PersonLocator.class);

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @Inject
    EvidenceContentResolver contentResolver;

    @Inject
    Instance<IdentityMatcherFactory> matcherFactories;

    /** The deployed identity-matching collaborator, if any. */
    public Optional<IdentityMatcherFactory> matcherFactory() {
        return matcherFactories.isResolvable() ? Optional.of(matcherFactories.get()) : Optional.empty();
    }

    /**
     * Loads {@code referencePhoto} into the deployed matcher.
     *
     * @throws IllegalStateException if no identity matcher is deployed
     * @throws UncheckedIOException  if the photo cannot be loaded
     */
    public IdentityMatcher matcherFor(Path referencePhoto) {
        IdentityMatcherFactory factory = matcherFactory()
                .orElseThrow(() -> new IllegalStateException("No identity matcher is deployed"));
        try {
            return factory.forReference(referencePhoto);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load reference photo " + referencePhoto, e);
        }
    }

    /**
     * Images of the case showing the person in {@code referencePhoto}, most
     * confident first.
     */
    public List<SearchMatch> findPerson(long caseId, Path referencePhoto, ProgressListener progress) {
        caseRepository.requireCase(caseId);
        List<FaceHit> hits = scan(caseId, matcherFor(referencePhoto), progress);
        log.infof("Case %d: person found in %d images", caseId, hits.size());
        return hits.stream()
                .sorted(Comparator.comparingDouble((FaceHit h) -> h.match().confidence()).reversed())
                .map(h -> new SearchMatch(h.file(), List.of(faceReason(h.match())), 1, h.match().confidence()))
                .toList();
    }

    /**
     * Runs {@code matcher} over every image of the case in case order. An
     * image the matcher cannot process is logged and skipped.
     */
    public List<FaceHit> scan(long caseId, IdentityMatcher matcher, ProgressListener progress) {
        ProgressListener listener = ProgressListener.orNone(progress);
        List<EvidenceFileRecord> images = fileRepository.getFilesByCase(caseId, Set.of(EvidenceCategory.IMAGE));
        List<FaceHit> hits = new ArrayList<>();
        int done = 0;
        for (EvidenceFileRecord image : images) {
            try (LocalCopy copy = contentResolver.materialize(image)) {
                IdentityMatch match = matcher.match(copy.path());
                if (match != null && match.matched()) {
                    hits.add(new FaceHit(image, match));
                }
            } catch (IOException | RuntimeException e) {
                log.errorf("Face matching error for %s: %s", image.fileName(), e.getMessage());
            }
            listener.onProgress(++done, images.size(), "Matching: " + image.fileName());
        }
        return hits;
    }

    static String faceReason(IdentityMatch match) {
        return String.format(Locale.ROOT, "Face match: %.1f%% confidence", match.confidence());
    }
}
