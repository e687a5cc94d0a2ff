package com.glisk.backend.reveal.chain;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * GliskNFT contract access used by the pipeline.
 */
public interface BlockchainClient {

    /**
     * Next token id the contract will assign (exclusive upper bound of minted ids).
     * RPC failures are retried; exhaustion raises
     * {@link com.glisk.backend.common.error.BlockchainConnectionException}.
     */
    long readNextTokenId();

    /** Signs and sends {@code revealTokens(ids, uris)}. Does not wait for inclusion. */
    RevealHandle submitBatchReveal(List<Long> tokenIds, List<String> metadataUris,
                                   GasStrategy gasStrategy, double gasBuffer);

    ConfirmationResult waitForConfirmation(RevealHandle handle, Duration timeout);

    /** Receipt of an earlier transaction; empty while it is unknown or still pending. */
    Optional<ConfirmationResult> findReceipt(String txHash);
}
