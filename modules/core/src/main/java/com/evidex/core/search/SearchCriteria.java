package com.evidex.core.search;

import com.evidex.types.EvidenceCategory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What to look for in a case.
 *
 * @param identity       person name or identifier, or null
 * @param dateRange      day range, or null
 * @param keywords       keywords, matched case-insensitively
 * @param fileTypes      categories to search; empty means all
 * @param referenceImage photo of the person for identity matching, or null
 */
public record SearchCriteria(
        String identity,
        DateRange dateRange,
        List<String> keywords,
        Set<EvidenceCategory> fileTypes,
        Path referenceImage
) {
    public SearchCriteria {
        identity = identity == null || identity.isBlank() ? null : identity.trim();
        keywords = keywords == null ? List.of() : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .toList();
        fileTypes = fileTypes == null || fileTypes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(fileTypes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean allTypes() {
        return fileTypes.isEmpty();
    }

    public static final class Builder {
        private String identity;
        private DateRange dateRange;
        private final List<String> keywords = new ArrayList<>();
        private final Set<EvidenceCategory> fileTypes = EnumSet.noneOf(EvidenceCategory.class);
        private Path referenceImage;

        private Builder() {
        }

        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public Builder keyword(String... values) {
            keywords.addAll(List.of(values));
            return this;
        }

        public Builder keywords(List<String> values) {
            keywords.addAll(values);
            return this;
        }

        public Builder fileType(EvidenceCategory... types) {
            fileTypes.addAll(List.of(types));
            return this;
        }

        public Builder fileTypes(Set<EvidenceCategory> types) {
            fileTypes.addAll(types);
            return this;
        }

        public Builder referenceImage(Path referenceImage) {
            this.referenceImage = referenceImage;
            return this;
        }

        public SearchCriteria build() {
            return new SearchCriteria(identity, dateRange, keywords, fileTypes, referenceImage);
        }
    }
}
