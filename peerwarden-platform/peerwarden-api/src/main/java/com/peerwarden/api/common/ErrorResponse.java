package com.peerwarden.api.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every controller.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String code, String message, Map<String, Object> details) {

    public ErrorResponse(String code, String message) {
        this(code, message, Map.of());
    }
}
