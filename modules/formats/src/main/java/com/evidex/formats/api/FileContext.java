package com.evidex.formats.api;

import com.evidex.formats.category.ForensicCategorizer;
import com.evidex.types.ExtractionFormat;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything an {@link IndexerFactory} needs to open one container.
 *
 * @param source      path of the container on disk
 * @param format      detected format tag
 * @param codec       transport codec wrapping the container (gzip, bzip2), if any
 * @param categorizer categorizer used to label discovered entries
 */
public record FileContext(
        Path source,
        ExtractionFormat format,
        Optional<Codec> codec,
        ForensicCategorizer categorizer
) {
    public FileContext {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(categorizer, "categorizer");
        codec = codec == null ? Optional.empty() : codec;
    }

    public static FileContext of(Path source, ExtractionFormat format, ForensicCategorizer categorizer) {
        return new FileContext(source, format, Optional.empty(), categorizer);
    }

    public String filename() {
        Path name = source.getFileName();
        return name != null ? name.toString() : source.toString();
    }
}
