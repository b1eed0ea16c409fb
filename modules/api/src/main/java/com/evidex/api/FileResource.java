package com.evidex.api;

import com.evidex.api.dto.FlagRequest;
import com.evidex.api.dto.NoteRequest;
import com.evidex.core.cases.CaseManager;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.core.hash.HashBackfillService;
import com.evidex.core.repository.FileRepository;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.Map;

@Path("/api/files/{fileId}")
@Produces(MediaType.APPLICATION_JSON)
public class FileResource {

    @Inject
    CaseManager caseManager;

    @Inject
    FileRepository fileRepository;

    @Inject
    HashBackfillService hashBackfillService;

    @GET
    public EvidenceFileRecord get(@PathParam("fileId") long fileId) {
        return fileRepository.requireFile(fileId);
    }

    @PUT
    @Path("/flag")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvidenceFileRecord flag(@PathParam("fileId") long fileId, FlagRequest request) {
        return caseManager.flagFile(fileId, request == null ? null : request.reason());
    }

    @DELETE
    @Path("/flag")
    public EvidenceFileRecord unflag(@PathParam("fileId") long fileId) {
        return caseManager.unflagFile(fileId);
    }

    @PUT
    @Path("/note")
    @Consumes(MediaType.APPLICATION_JSON)
    public EvidenceFileRecord note(@PathParam("fileId") long fileId, NoteRequest request) {
        fileRepository.addNote(fileId, request == null ? null : request.note());
        return fileRepository.requireFile(fileId);
    }

    /** Returns the stored SHA-256, computing it first if the file has none. */
    @GET
    @Path("/hash")
    public Map<String, Object> hash(@PathParam("fileId") long fileId) {
        return Map.of("fileId", fileId, "sha256", hashBackfillService.ensureHash(fileId));
    }
}
