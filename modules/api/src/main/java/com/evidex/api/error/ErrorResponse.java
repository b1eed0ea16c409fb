package com.evidex.api.error;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

public record ErrorResponse(String error, String message) {

    public static Response of(int status, Throwable e) {
        return of(status, e.getClass().getSimpleName(), e.getMessage());
    }

    public static Response of(int status, String error, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, message))
                .build();
    }
}
