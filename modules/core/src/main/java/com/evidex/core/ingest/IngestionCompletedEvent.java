package com.evidex.core.ingest;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Fired via CDI after an ingestion run has been recounted and audited.
 */
public record IngestionCompletedEvent(
        long caseId,
        Path source,
        IngestionStats stats,
        Instant completedAt
) {}
