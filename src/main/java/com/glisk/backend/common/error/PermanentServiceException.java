package com.glisk.backend.common.error;

/** Auth failure, bad request, validation error. Retrying will not help. */
public class PermanentServiceException extends ServiceException {

    public PermanentServiceException(String code, String message) {
        this(code, message, null);
    }

    public PermanentServiceException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
