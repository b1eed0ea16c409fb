package com.evidex.api.dto;

import com.evidex.core.search.DateRange;
import com.evidex.core.search.SearchCriteria;
import com.evidex.types.EvidenceCategory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * @param fileTypes category labels; absent, empty or {@code ["all"]} searches every type
 */
public record SearchRequest(
        String person,
        LocalDate dateFrom,
        LocalDate dateTo,
        List<String> keywords,
        List<String> fileTypes,
        String referenceImage
) {
    public SearchCriteria toCriteria() {
        SearchCriteria.Builder builder = SearchCriteria.builder().identity(person);
        if (dateFrom != null || dateTo != null) {
            builder.dateRange(new DateRange(dateFrom, dateTo));
        }
        if (keywords != null) {
            builder.keywords(keywords);
        }
        if (fileTypes != null && !fileTypes.contains("all")) {
            for (String label : fileTypes) {
                builder.fileType(EvidenceCategory.fromLabel(label));
            }
        }
        if (referenceImage != null && !referenceImage.isBlank()) {
            builder.referenceImage(Path.of(referenceImage));
        }
        return builder.build();
    }
}
