package com.evidex.api;

import com.evidex.core.repository.AuditEntry;
import com.evidex.core.repository.AuditRepository;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/** Read-only view of the audit trail across all cases. */
@Path("/api/audit")
@Produces(MediaType.APPLICATION_JSON)
public class AuditResource {

    @Inject
    AuditRepository auditRepository;

    @GET
    public List<AuditEntry> list(@QueryParam("action") String action,
                                 @QueryParam("limit") @DefaultValue("100") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return action == null || action.isBlank()
                ? auditRepository.getAllLogs(limit)
                : auditRepository.getLogsByAction(action, limit);
    }
}
