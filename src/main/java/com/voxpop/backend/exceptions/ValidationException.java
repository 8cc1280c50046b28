package com.voxpop.backend.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A malformed or missing field on a single-contact, single-row or single-resource operation.
 * Carries the offending field name(s) so the caller can point at them.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String field, String message) {
        super(message);
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put(field, message);
        this.fieldErrors = Collections.unmodifiableMap(errors);
    }

    public ValidationException(Map<String, String> fieldErrors) {
        super(summarize(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /**
     * First offending field, or null when none was recorded.
     */
    public String getField() {
        return fieldErrors.isEmpty() ? null : fieldErrors.keySet().iterator().next();
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    private static String summarize(Map<String, String> fieldErrors) {
        if (fieldErrors == null || fieldErrors.isEmpty()) {
            return "Validation failed";
        }
        if (fieldErrors.size() == 1) {
            return fieldErrors.values().iterator().next();
        }
        return "Validation failed for fields " + fieldErrors.keySet();
    }
}
