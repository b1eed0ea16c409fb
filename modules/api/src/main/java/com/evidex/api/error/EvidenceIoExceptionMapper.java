package com.evidex.api.error;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

/**
 * Evidence paths that do not exist or cannot be read.
 */
@Provider
public class EvidenceIoExceptionMapper implements ExceptionMapper<IOException> {

    private static final Logger log = Logger.getLogger(EvidenceIoExceptionMapper.class);

    @Override
    public Response toResponse(IOException e) {
        if (!(e instanceof NoSuchFileException) && !(e instanceof NotDirectoryException)) {
            log.warnf(e, "Evidence I/O failed: %s", e.getMessage());
        }
        return ErrorResponse.of(422, e);
    }
}
