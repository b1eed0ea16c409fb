package com.evidex.api.error;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Unknown labels, inverted date ranges and missing fields.
 */
@Provider
public class InvalidRequestMapper implements ExceptionMapper<IllegalArgumentException> {

    @Override
    public Response toResponse(IllegalArgumentException e) {
        return ErrorResponse.of(422, "InvalidRequest", e.getMessage());
    }
}
