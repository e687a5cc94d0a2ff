package com.glisk.backend.common.error;

public class TransactionRevertedException extends PermanentServiceException {

    private final String txHash;

    public TransactionRevertedException(String txHash, String message) {
        super("TX_REVERTED", message);
        this.txHash = txHash;
    }

    public String txHash() { return txHash; }
}
