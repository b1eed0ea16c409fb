package com.evidex.formats.registry;

import com.evidex.formats.api.*;
import com.evidex.formats.category.ForensicCategorizer;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Central registry that matches containers to indexer factories and codecs.
 * All {@link IndexerFactory} and {@link Codec} beans are discovered via CDI.
 */
@Singleton
public class IndexerRegistry {

    private static final Logger log = Logger.getLogger(IndexerRegistry.class);

    /** Header size to read for detection (covers TAR magic at offset 257). */
    public static final int HEADER_SIZE = 512;

    private final List<IndexerFactory> factories;
    private final List<Codec> codecs;
    private final ForensicCategorizer categorizer;

    @Inject
    IndexerRegistry(Instance<IndexerFactory> factories, Instance<Codec> codecs, ForensicCategorizer categorizer) {
        this(factories.stream().toList(), codecs.stream().toList(), categorizer);
    }

    public IndexerRegistry(List<IndexerFactory> factories, List<Codec> codecs, ForensicCategorizer categorizer) {
        this.factories = List.copyOf(factories);
        this.codecs = List.copyOf(codecs);
        this.categorizer = categorizer;
    }

    /**
     * Highest-priority factory that can open {@code format}.
     */
    public Optional<IndexerFactory> findFactory(ExtractionFormat format) {
        return factories.stream()
                .filter(f -> f.supportedFormats().contains(format))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }

    /**
     * Highest-priority factory whose signature matches the header or sniffed MIME type.
     */
    public Optional<IndexerFactory> findBySignature(String mimeType, byte[] header) {
        return factories.stream()
                .filter(f -> f.getDetectionCriteria().matchesSignature(mimeType, header))
                .max(Comparator.comparingInt(f -> f.getDetectionCriteria().priority()));
    }

    /**
     * Finds a codec matching the given header and filename.
     */
    public Optional<Codec> findCodec(byte[] header, String filename) {
        return codecs.stream()
                .filter(c -> c.matches(header, filename))
                .findFirst();
    }

    /**
     * Opens an indexer for a container whose format has already been detected.
     *
     * @throws UnsupportedFormatException if no factory supports {@code format}
     */
    public ArchiveIndexer open(Path source, ExtractionFormat format) throws IOException {
        IndexerFactory factory = findFactory(format)
                .orElseThrow(() -> new UnsupportedFormatException(source, format));
        String filename = source.getFileName() != null ? source.getFileName().toString() : null;
        Optional<Codec> codec = findCodec(readHeader(source, HEADER_SIZE), filename);
        codec.ifPresent(c -> log.debugf("Container %s wrapped in %s", source, c.name()));
        return factory.createInstance(new FileContext(source, format, codec, categorizer));
    }

    public static byte[] readHeader(Path source, int size) throws IOException {
        try (InputStream in = Files.newInputStream(source)) {
            return in.readNBytes(size);
        }
    }
}
