package com.glisk.backend.recovery;

import java.util.List;

/**
 * @param onChainCount      contract nextTokenId (ids 0 .. onChainCount-1 exist on chain)
 * @param missingCount      ids absent from the store that this run attempted (after the limit)
 * @param recoveredCount    rows inserted (or that would be, on a dry run)
 * @param skippedDuplicates ids inserted concurrently by someone else during the run
 * @param remainingCount    gaps left for a later run because of the limit
 */
public record RecoveryResult(
        long onChainCount,
        int missingCount,
        int recoveredCount,
        int skippedDuplicates,
        int remainingCount,
        boolean dryRun,
        List<String> errors
) {

    public static RecoveryResult noGaps(long onChainCount, boolean dryRun) {
        return new RecoveryResult(onChainCount, 0, 0, 0, 0, dryRun, List.of());
    }

    public boolean complete() {
        return recoveredCount + skippedDuplicates == missingCount && remainingCount == 0;
    }
}
