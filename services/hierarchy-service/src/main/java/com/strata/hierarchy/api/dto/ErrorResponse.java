package com.strata.hierarchy.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * Failure envelope.
 *
 * @param error human-readable message
 * @param errorCode stable code, e.g. {@code not_found}
 * @param errors flattened messages, validation failures only
 * @param fieldErrors messages per request field, validation failures only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        boolean success,
        String error,
        String errorCode,
        List<String> errors,
        Map<String, List<String>> fieldErrors) {

    public static ErrorResponse of(String errorCode, String error) {
        return new ErrorResponse(false, error, errorCode, null, null);
    }

    public static ErrorResponse validation(
            String error, List<String> errors, Map<String, List<String>> fieldErrors) {
        return new ErrorResponse(false, error, "validation_failed", errors, fieldErrors);
    }
}
