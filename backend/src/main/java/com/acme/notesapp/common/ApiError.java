package com.acme.notesapp.common;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String code, String message, String detail) {
    public ApiError(String code, String message) {
        this(code, message, null);
    }
}
