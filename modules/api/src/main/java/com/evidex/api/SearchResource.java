package com.evidex.api;

import com.evidex.api.dto.SearchRequest;
import com.evidex.core.search.ForensicSearchEngine;
import com.evidex.core.search.SearchMatch;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api/cases/{caseId}/search")
@Produces(MediaType.APPLICATION_JSON)
public class SearchResource {

    @Inject
    ForensicSearchEngine searchEngine;

    /** Ranked matches, most matched criteria first. */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public List<SearchMatch> search(@PathParam("caseId") long caseId, SearchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return searchEngine.search(caseId, request.toCriteria());
    }
}
