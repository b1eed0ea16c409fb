package com.evidex.api.error;

import com.evidex.core.analysis.AnalysisFailureException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class AnalysisFailureExceptionMapper implements ExceptionMapper<AnalysisFailureException> {

    @Override
    public Response toResponse(AnalysisFailureException e) {
        return ErrorResponse.of(422, e);
    }
}
