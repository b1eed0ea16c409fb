package com.evidex.api.error;

import com.evidex.formats.api.FormatException;
import com.evidex.formats.api.UnsupportedFormatException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class FormatExceptionMapper implements ExceptionMapper<FormatException> {

    @Override
    public Response toResponse(FormatException e) {
        return ErrorResponse.of(e instanceof UnsupportedFormatException ? 415 : 422, e);
    }
}
