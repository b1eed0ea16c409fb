package com.evidex.formats.api;

import com.evidex.types.ExtractionFormat;

import java.io.IOException;
import java.util.Set;

/**
 * Factory for creating {@link ArchiveIndexer} instances.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface IndexerFactory {
    /**
     * Returns criteria for recognising containers this factory opens.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Format tags this factory can open.
     */
    Set<ExtractionFormat> supportedFormats();

    /**
     * Tag reported when a container is recognised by content alone.
     */
    ExtractionFormat sniffedFormat();

    /**
     * Opens an indexer over the container described by {@code context}.
     */
    ArchiveIndexer createInstance(FileContext context) throws IOException;
}
