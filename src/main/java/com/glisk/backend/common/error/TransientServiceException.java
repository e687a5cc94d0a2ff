package com.glisk.backend.common.error;

/** Network error, rate limit, upstream 5xx or timeout. Safe to retry later. */
public class TransientServiceException extends ServiceException {

    private final Integer retryAfterSec;

    public TransientServiceException(String code, String message) {
        this(code, message, null, null);
    }

    public TransientServiceException(String code, String message, Integer retryAfterSec, Throwable cause) {
        super(code, message, cause);
        this.retryAfterSec = retryAfterSec;
    }

    /** server-provided hint, null when absent */
    public Integer retryAfterSec() { return retryAfterSec; }
}
