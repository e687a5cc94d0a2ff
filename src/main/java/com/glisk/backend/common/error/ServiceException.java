package com.glisk.backend.common.error;

/**
 * Root of the failures raised by external service clients. {@code code} is a short, stable
 * identifier (e.g. {@code STORAGE_RATE_LIMITED}) that ends up in logs and in {@code generation_error}.
 */
public abstract class ServiceException extends RuntimeException {

    private final String code;

    protected ServiceException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() { return code; }

    /** code plus message, the form persisted on a failed token */
    public String describe() {
        String m = getMessage();
        return (m == null || m.isBlank()) ? code : code + ": " + m;
    }
}
