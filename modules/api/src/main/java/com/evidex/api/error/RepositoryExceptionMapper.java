package com.evidex.api.error;

import com.evidex.core.repository.CaseNotFoundException;
import com.evidex.core.repository.DuplicateCaseNumberException;
import com.evidex.core.repository.EvidenceFileNotFoundException;
import com.evidex.core.repository.ForeignKeyViolationException;
import com.evidex.core.repository.RepositoryException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class RepositoryExceptionMapper implements ExceptionMapper<RepositoryException> {

    private static final Logger log = Logger.getLogger(RepositoryExceptionMapper.class);

    @Override
    public Response toResponse(RepositoryException e) {
        if (e instanceof CaseNotFoundException || e instanceof EvidenceFileNotFoundException) {
            return ErrorResponse.of(404, e);
        }
        if (e instanceof DuplicateCaseNumberException) {
            return ErrorResponse.of(409, e);
        }
        if (e instanceof ForeignKeyViolationException) {
            return ErrorResponse.of(422, e);
        }
        log.error("Unhandled repository failure", e);
        return ErrorResponse.of(500, e);
    }
}
