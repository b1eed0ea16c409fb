package com.evidex.api.error;

import com.evidex.core.hash.HashComputationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class HashComputationExceptionMapper implements ExceptionMapper<HashComputationException> {

    @Override
    public Response toResponse(HashComputationException e) {
        return ErrorResponse.of(422, e);
    }
}
