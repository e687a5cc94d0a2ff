package com.glisk.backend.common.error;

public class TransactionTimeoutException extends TransientServiceException {

    private final String txHash;

    public TransactionTimeoutException(String txHash, String message) {
        super("TX_TIMEOUT", message, null, null);
        this.txHash = txHash;
    }

    public String txHash() { return txHash; }
}
