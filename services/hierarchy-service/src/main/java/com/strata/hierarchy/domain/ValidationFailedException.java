package com.strata.hierarchy.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input rejected before anything was written.
 *
 * <p>Carries per-field messages, e.g. {@code name -> ["has already been taken"]}.
 */
public class ValidationFailedException extends HierarchyException {

    private final Map<String, List<String>> fieldErrors;

    public ValidationFailedException(Map<String, List<String>> fieldErrors) {
        super("validation_failed", "Validation failed: " + fieldErrors.keySet());
        var copy = new LinkedHashMap<String, List<String>>();
        fieldErrors.forEach((field, messages) -> copy.put(field, List.copyOf(messages)));
        this.fieldErrors = Collections.unmodifiableMap(copy);
    }

    public static ValidationFailedException of(String field, String message) {
        return new ValidationFailedException(Map.of(field, List.of(message)));
    }

    public Map<String, List<String>> fieldErrors() {
        return fieldErrors;
    }

    /** Flattened "field message" strings for the {@code errors} response field. */
    public List<String> messages() {
        var messages = new ArrayList<String>();
        fieldErrors.forEach((field, list) -> list.forEach(m -> messages.add(field + " " + m)));
        return messages;
    }

    /** Collects field errors and throws once, with all of them. */
    public static final class Collector {

        private final Map<String, List<String>> errors = new LinkedHashMap<>();

        public Collector add(String field, String message) {
            errors.computeIfAbsent(field, f -> new ArrayList<>()).add(message);
            return this;
        }

        public boolean isEmpty() {
            return errors.isEmpty();
        }

        public void throwIfAny() {
            if (!errors.isEmpty()) {
                throw new ValidationFailedException(errors);
            }
        }
    }
}
