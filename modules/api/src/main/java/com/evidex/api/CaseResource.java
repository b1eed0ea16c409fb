package com.evidex.api;

import com.evidex.api.dto.CreateCaseRequest;
import com.evidex.api.dto.UpdateCaseRequest;
import com.evidex.core.cases.CaseManager;
import com.evidex.core.cases.CaseSummary;
import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseStatisticsRecord;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.repository.AuditEntry;
import com.evidex.core.repository.AuditRepository;
import com.evidex.core.repository.CaseNotFoundException;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.types.CaseStatus;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import org.jboss.logging.Logger;

import java.util.List;

@Path("/api/cases")
@Produces(MediaType.APPLICATION_JSON)
public class CaseResource {

    private static final Logger log = Logger.getLogger(CaseResource.class);

    @Inject
    CaseManager caseManager;

    @Inject
    CaseRepository caseRepository;

    @Inject
    FileRepository fileRepository;

    @Inject
    AuditRepository auditRepository;

    @GET
    public List<CaseRecord> list(@QueryParam("status") String status) {
        return caseManager.listCases(status == null || status.isBlank() ? null : CaseStatus.fromLabel(status));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(CreateCaseRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        CaseRecord created = caseManager.createCase(request.toNewCase());
        log.infof("Created case %s (%d)", created.caseNumber(), created.caseId());
        return Response.created(UriBuilder.fromResource(CaseResource.class)
                        .path(String.valueOf(created.caseId())).build())
                .entity(created)
                .build();
    }

    /** Opens the case, recording the access in the audit trail. */
    @GET
    @Path("/{caseId}")
    public CaseRecord get(@PathParam("caseId") long caseId) {
        return caseManager.openCase(caseId).orElseThrow(() -> new CaseNotFoundException(caseId));
    }

    @PUT
    @Path("/{caseId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public CaseRecord update(@PathParam("caseId") long caseId, UpdateCaseRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return caseManager.updateCase(caseId, request.toUpdate());
    }

    @POST
    @Path("/{caseId}/close")
    public CaseRecord close(@PathParam("caseId") long caseId) {
        return caseManager.closeCase(caseId);
    }

    @POST
    @Path("/{caseId}/reopen")
    public CaseRecord reopen(@PathParam("caseId") long caseId) {
        return caseManager.reopenCase(caseId);
    }

    @GET
    @Path("/{caseId}/summary")
    public CaseSummary summary(@PathParam("caseId") long caseId) {
        return caseManager.summary(caseId);
    }

    @GET
    @Path("/{caseId}/statistics")
    public CaseStatisticsRecord statistics(@PathParam("caseId") long caseId) {
        caseRepository.requireCase(caseId);
        return caseRepository.getCaseStatistics(caseId);
    }

    @GET
    @Path("/{caseId}/files")
    public List<EvidenceFileRecord> files(@PathParam("caseId") long caseId,
                                          @QueryParam("flagged") @DefaultValue("false") boolean flaggedOnly) {
        caseRepository.requireCase(caseId);
        return fileRepository.getFilesByCase(caseId, flaggedOnly);
    }

    @GET
    @Path("/{caseId}/audit")
    public List<AuditEntry> audit(@PathParam("caseId") long caseId,
                                  @QueryParam("limit") @DefaultValue("100") int limit) {
        caseRepository.requireCase(caseId);
        return auditRepository.getCaseLogs(caseId, limit);
    }
}
