package com.glisk.backend.common.error;

public class BlockchainConnectionException extends TransientServiceException {

    public BlockchainConnectionException(String message, Throwable cause) {
        super("BLOCKCHAIN_CONNECTION_ERROR", message, null, cause);
    }
}
