package org.rostilos.labgate.core.exception;

/**
 * Base exception for all errors reported back to callers.
 * The error code is machine-readable and stable across releases.
 */
public class LabGateException extends RuntimeException {

    private final String errorCode;

    public LabGateException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    public LabGateException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
