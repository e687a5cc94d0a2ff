package com.glisk.backend.reveal.chain;

public record ConfirmationResult(Outcome outcome, String txHash, Long blockNumber, Long gasUsed) {

    public enum Outcome { CONFIRMED, REVERTED, TIMEOUT }

    public static ConfirmationResult confirmed(String txHash, long blockNumber, long gasUsed) {
        return new ConfirmationResult(Outcome.CONFIRMED, txHash, blockNumber, gasUsed);
    }

    public static ConfirmationResult reverted(String txHash, Long blockNumber, Long gasUsed) {
        return new ConfirmationResult(Outcome.REVERTED, txHash, blockNumber, gasUsed);
    }

    public static ConfirmationResult timeout(String txHash) {
        return new ConfirmationResult(Outcome.TIMEOUT, txHash, null, null);
    }

    public boolean isConfirmed() {
        return outcome == Outcome.CONFIRMED;
    }
}
