package com.evidex.core.search;

import com.evidex.core.dao.EvidenceFileRecord;

import java.util.List;

/**
 * One file that matched, with the reasons it matched.
 *
 * @param file           the matching evidence file
 * @param reasons        human-readable explanations, one per matched criterion
 * @param matchCount     number of matched criteria, used for ranking
 * @param faceConfidence best identity-match confidence in percent, or null
 */
public record SearchMatch(
        EvidenceFileRecord file,
        List<String> reasons,
        int matchCount,
        Double faceConfidence
) {
    public SearchMatch {
        reasons = List.copyOf(reasons);
    }

    public long fileId() {
        return file.fileId();
    }
}
