package com.evidex.core.analysis;

import com.evidex.types.EvidenceCategory;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The analyzers enabled for this installation.
 *
 * <p>All {@link FileAnalyzer} beans are discovered via CDI and filtered by
 * {@code evidex.analysis.enabled-analyzers} (all are enabled when unset).
 * Built once at injection time.
 */
@Singleton
public class AnalyzerRegistry {

    private static final Logger log = Logger.getLogger(AnalyzerRegistry.class);

    private final List<FileAnalyzer> analyzers;

    @Inject
    AnalyzerRegistry(Instance<FileAnalyzer> discovered,
                     @ConfigProperty(name = "evidex.analysis.enabled-analyzers") Optional<List<String>> enabled) {
        this(discovered.stream().toList(), enabled.map(Set::copyOf));
    }

    public AnalyzerRegistry(List<FileAnalyzer> analyzers, Optional<Set<String>> enabledNames) {
        this.analyzers = analyzers.stream()
                .filter(a -> enabledNames.map(names -> names.contains(a.name())).orElse(true))
                .sorted(Comparator.comparing(FileAnalyzer::name))
                .toList();
        log.infof("Analyzers enabled: %s", this.analyzers.stream()
                .map(FileAnalyzer::name).collect(Collectors.joining(", ", "[", "]")));
    }

    public List<FileAnalyzer> all() {
        return analyzers;
    }

    public List<FileAnalyzer> forCategory(EvidenceCategory category) {
        return analyzers.stream().filter(a -> a.supports(category)).toList();
    }

    public Optional<FileAnalyzer> byName(String name) {
        return analyzers.stream().filter(a -> a.name().equals(name)).findFirst();
    }
}
