package com.ivamare.bulkload.exception;

import java.util.Map;

/**
 * Raised by a finalize policy when continuing the pool would be unsafe,
 * for example when partition metadata is inconsistent.
 *
 * <p>The supervisor stops dispatching, cancels pending work and abandons
 * whatever is still in flight.
 */
public class UnrecoverableConditionException extends BulkLoadException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public UnrecoverableConditionException(String code, String message) {
        this(code, message, Map.of());
    }

    public UnrecoverableConditionException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
