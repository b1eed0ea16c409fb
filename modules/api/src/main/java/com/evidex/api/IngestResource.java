package com.evidex.api;

import com.evidex.api.dto.IngestRequest;
import com.evidex.core.analysis.AnalysisService;
import com.evidex.core.analysis.AnalysisSummary;
import com.evidex.core.hash.BackfillResult;
import com.evidex.core.hash.HashBackfillService;
import com.evidex.core.ingest.CancellationToken;
import com.evidex.core.ingest.IngestionService;
import com.evidex.core.ingest.IngestionStats;
import com.evidex.formats.api.ProgressListener;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Long-running case operations. Each request runs to completion on the
 * calling thread and reports progress to the log.
 */
@Path("/api/cases/{caseId}")
@Produces(MediaType.APPLICATION_JSON)
public class IngestResource {

    private static final Logger log = Logger.getLogger(IngestResource.class);

    @Inject
    IngestionService ingestionService;

    @Inject
    HashBackfillService hashBackfillService;

    @Inject
    AnalysisService analysisService;

    @POST
    @Path("/ingest")
    @Consumes(MediaType.APPLICATION_JSON)
    public IngestionStats ingest(@PathParam("caseId") long caseId, IngestRequest request) throws IOException {
        if (request == null || request.path() == null || request.path().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        java.nio.file.Path source = java.nio.file.Path.of(request.path());
        int workers = request.workers() != null && request.workers() > 0
                ? request.workers()
                : ingestionService.defaultWorkerCount();
        ProgressListener progress = progressLog(caseId);

        CancellationToken token = CancellationToken.create();
        return switch (request.modeOrDefault()) {
            case "index" -> ingestionService.ingest(source, caseId, workers, progress, token);
            case "full" -> ingestionService.ingestWithFullExtraction(source, caseId, targetDir(request),
                    request.entryFilter(), workers, progress, token);
            case "directory" -> ingestionService.importDirectory(source, caseId, workers, progress, token);
            default -> throw new IllegalArgumentException("Unknown ingest mode: " + request.mode());
        };
    }

    @POST
    @Path("/hashes")
    public BackfillResult backfillHashes(@PathParam("caseId") long caseId) {
        return hashBackfillService.backfillCase(caseId, progressLog(caseId));
    }

    @POST
    @Path("/analysis")
    public AnalysisSummary analyze(@PathParam("caseId") long caseId) {
        return analysisService.analyzeCase(caseId, progressLog(caseId));
    }

    private static java.nio.file.Path targetDir(IngestRequest request) {
        return request.targetDir() == null || request.targetDir().isBlank()
                ? null
                : java.nio.file.Path.of(request.targetDir());
    }

    private static ProgressListener progressLog(long caseId) {
        return (current, total, message) -> log.debugf("case %d: %d/%d %s", caseId, current, total, message);
    }
}
