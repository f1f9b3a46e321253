package org.rostilos.labgate.core.exception;

import java.util.List;

/**
 * Caller-supplied data is malformed. Never retried.
 */
public class ValidationException extends LabGateException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors), ERROR_CODE);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
