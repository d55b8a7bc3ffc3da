package com.uproom.saas.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    public final String error;
    public final String message;
    public final List<String> alternatives;

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }

    public ErrorResponse(String error, String message, List<String> alternatives) {
        this.error = error;
        this.message = message;
        this.alternatives = alternatives;
    }
}
