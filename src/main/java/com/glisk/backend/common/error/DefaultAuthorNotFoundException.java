package com.glisk.backend.common.error;

public class DefaultAuthorNotFoundException extends PermanentServiceException {

    public DefaultAuthorNotFoundException(String wallet) {
        super("DEFAULT_AUTHOR_NOT_FOUND", "Default author not found: " + wallet);
    }
}
