package com.evidex.formats.category;

import com.evidex.types.EvidenceCategory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One entry of the ordered categorization table.
 *
 * @param name      label used in debug logs
 * @param category  category assigned when the rule matches
 * @param predicate test against the normalised file facts
 */
public record CategoryRule(String name, EvidenceCategory category, Predicate<FileFacts> predicate) {

    public CategoryRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(predicate, "predicate");
    }

    public boolean matches(FileFacts facts) {
        return predicate.test(facts);
    }

    static Predicate<FileFacts> nameIn(String... names) {
        Set<String> set = Set.of(names);
        return f -> set.contains(f.name());
    }

    static Predicate<FileFacts> nameMatches(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return f -> pattern.matcher(f.name()).matches();
    }

    static Predicate<FileFacts> extensionIn(String... extensions) {
        Set<String> set = Set.of(extensions);
        return f -> set.contains(f.extension());
    }

    static Predicate<FileFacts> extensionIn(Set<String> extensions) {
        return f -> extensions.contains(f.extension());
    }

    static Predicate<FileFacts> parentIn(String... folders) {
        Set<String> set = Set.of(folders);
        return f -> set.contains(f.parentFolder());
    }

    /** Any directory segment equal to one of {@code segments}. */
    static Predicate<FileFacts> segmentIn(String... segments) {
        Set<String> set = Set.of(segments);
        return f -> f.segments().stream().anyMatch(set::contains);
    }

    /** Any directory segment containing one of {@code fragments}. */
    static Predicate<FileFacts> segmentContains(String... fragments) {
        return f -> f.segments().stream()
                .anyMatch(s -> Arrays.stream(fragments).anyMatch(s::contains));
    }
}
