package com.mikov.emailvalidator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorResponse {
    private final String error;
    private final String details;

    public ErrorResponse(final String error) {
        this.error = error;
        this.details = null;
    }

    public ErrorResponse(final String error, final String details) {
        this.error = error;
        this.details = details;
    }
}
