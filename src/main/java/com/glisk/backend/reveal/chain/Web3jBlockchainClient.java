package com.glisk.backend.reveal.chain;

import com.glisk.backend.common.error.BlockchainConnectionException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.ServiceException;
import com.glisk.backend.common.error.TransactionRevertedException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.common.util.RetryUtils;
import com.glisk.backend.reveal.config.BlockchainProperties;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * web3j implementation over JSON-RPC.
 * <ul>
 *   <li>reads: {@code nextTokenId()} via eth_call, retried 1s/2s/4s</li>
 *   <li>reveal: EIP-1559 transaction, gas = estimate * buffer, maxFee = 2 * baseFee + priority</li>
 *   <li>confirmation: receipt polling; status 0x0 is a revert, no receipt before the deadline is a timeout</li>
 * </ul>
 */
@Slf4j
public class Web3jBlockchainClient implements BlockchainClient {

    private final Web3j web3j;
    private final BlockchainProperties props;
    private volatile Credentials keeper;

    public Web3jBlockchainClient(Web3j web3j, BlockchainProperties props) {
        this.web3j = web3j;
        this.props = props;
    }

    @Override
    public long readNextTokenId() {
        requireContract();
        Function fn = new Function("nextTokenId", List.of(), List.of(new TypeReference<Uint256>() {}));
        String data = FunctionEncoder.encode(fn);

        try {
            return RetryUtils.executeWithRetry("nextTokenId", () -> {
                EthCall res = web3j.ethCall(
                        Transaction.createEthCallTransaction(null, props.getContractAddress(), data),
                        DefaultBlockParameterName.LATEST
                ).send();
                rpcCheck(res, "eth_call nextTokenId");
                if (res.isReverted()) {
                    throw new PermanentServiceException("CONTRACT_CALL_REVERTED", "nextTokenId reverted: " + res.getRevertReason());
                }

                List<Type> out = FunctionReturnDecoder.decode(res.getValue(), fn.getOutputParameters());
                if (out.isEmpty()) {
                    throw new PermanentServiceException("CONTRACT_NOT_FOUND",
                            "No nextTokenId() at " + props.getContractAddress());
                }
                long next = ((BigInteger) out.get(0).getValue()).longValueExact();
                log.info("chain.next_token_id value={}", next);
                return next;
            }, props.getRpcMaxAttempts(), props.getRpcInitialDelay(), Web3jBlockchainClient::isRetryable);
        } catch (PermanentServiceException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlockchainConnectionException("interrupted while reading nextTokenId", e);
        } catch (Exception e) {
            throw new BlockchainConnectionException(
                    "Failed to read nextTokenId after " + props.getRpcMaxAttempts() + " attempts: " + e.getMessage(), e);
        }
    }

    @Override
    public RevealHandle submitBatchReveal(List<Long> tokenIds, List<String> metadataUris,
                                          GasStrategy gasStrategy, double gasBuffer) {
        if (tokenIds.isEmpty() || tokenIds.size() != metadataUris.size()) {
            throw new IllegalArgumentException("tokenIds and metadataUris must be non-empty and the same length");
        }
        requireContract();
        Credentials creds = keeper();
        String data = FunctionEncoder.encode(revealFunction(tokenIds, metadataUris));

        try {
            BigInteger gasLimit = estimateGas(creds.getAddress(), data, gasBuffer, tokenIds.size());

            var priorityRes = web3j.ethMaxPriorityFeePerGas().send();
            rpcCheck(priorityRes, "eth_maxPriorityFeePerGas");
            BigInteger priority = gasStrategy.applyTo(priorityRes.getMaxPriorityFeePerGas(), gasBuffer);

            EthBlock blockRes = web3j.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false).send();
            rpcCheck(blockRes, "eth_getBlockByNumber");
            EthBlock.Block latest = blockRes.getBlock();
            BigInteger baseFee = latest == null || latest.getBaseFeePerGas() == null ? BigInteger.ZERO : latest.getBaseFeePerGas();
            BigInteger maxFee = baseFee.shiftLeft(1).add(priority);

            var nonceRes = web3j.ethGetTransactionCount(creds.getAddress(), DefaultBlockParameterName.PENDING).send();
            rpcCheck(nonceRes, "eth_getTransactionCount");
            BigInteger nonce = nonceRes.getTransactionCount();

            RawTransaction raw = RawTransaction.createTransaction(
                    props.getChainId(), nonce, gasLimit, props.getContractAddress(),
                    BigInteger.ZERO, data, priority, maxFee);
            String signed = Numeric.toHexString(TransactionEncoder.signMessage(raw, creds));

            EthSendTransaction sent = web3j.ethSendRawTransaction(signed).send();
            if (sent.hasError()) {
                throw new TransientServiceException("TX_SUBMISSION_FAILED",
                        "eth_sendRawTransaction: " + sent.getError().getMessage());
            }

            String txHash = sent.getTransactionHash();
            log.info("keeper.transaction_submitted txHash={} tokenCount={} nonce={} gasLimit={} maxFee={} priority={} strategy={}",
                    txHash, tokenIds.size(), nonce, gasLimit, maxFee, priority, gasStrategy);
            return new RevealHandle(txHash, List.copyOf(tokenIds), nonce);

        } catch (ServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new BlockchainConnectionException("RPC failure while submitting reveal: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // undecodable node responses and the like
            throw new BlockchainConnectionException("Unexpected error while submitting reveal: " + e, e);
        }
    }

    @Override
    public ConfirmationResult waitForConfirmation(RevealHandle handle, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            try {
                Optional<ConfirmationResult> r = fetchReceipt(handle.txHash());
                if (r.isPresent()) return r.get();
            } catch (IOException | TransientServiceException e) {
                // keep polling until the deadline
                log.warn("keeper.receipt_poll_failed txHash={} error={}", handle.txHash(), e.getMessage());
            }

            if (System.nanoTime() >= deadline) {
                log.warn("keeper.transaction_timeout txHash={} timeout={}", handle.txHash(), timeout);
                return ConfirmationResult.timeout(handle.txHash());
            }
            try {
                Thread.sleep(props.getReceiptPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ConfirmationResult.timeout(handle.txHash());
            }
        }
    }

    @Override
    public Optional<ConfirmationResult> findReceipt(String txHash) {
        try {
            return RetryUtils.executeWithRetry("receipt", () -> fetchReceipt(txHash),
                    props.getRpcMaxAttempts(), props.getRpcInitialDelay(), Web3jBlockchainClient::isRetryable);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlockchainConnectionException("interrupted while reading receipt", e);
        } catch (Exception e) {
            throw new BlockchainConnectionException("Failed to read receipt " + txHash + ": " + e.getMessage(), e);
        }
    }

    private Optional<ConfirmationResult> fetchReceipt(String txHash) throws IOException {
        var res = web3j.ethGetTransactionReceipt(txHash).send();
        rpcCheck(res, "eth_getTransactionReceipt");
        Optional<TransactionReceipt> receipt = res.getTransactionReceipt();
        if (receipt.isEmpty()) return Optional.empty();

        TransactionReceipt r = receipt.get();
        long block = r.getBlockNumber() == null ? 0L : r.getBlockNumber().longValue();
        long gasUsed = r.getGasUsed() == null ? 0L : r.getGasUsed().longValue();
        if (r.isStatusOK()) {
            log.info("keeper.transaction_confirmed txHash={} block={} gasUsed={}", txHash, block, gasUsed);
            return Optional.of(ConfirmationResult.confirmed(txHash, block, gasUsed));
        }
        log.error("keeper.transaction_reverted txHash={} block={} gasUsed={}", txHash, block, gasUsed);
        return Optional.of(ConfirmationResult.reverted(txHash, block, gasUsed));
    }

    private BigInteger estimateGas(String from, String data, double gasBuffer, int tokenCount) throws IOException {
        var est = web3j.ethEstimateGas(Transaction.createEthCallTransaction(from, props.getContractAddress(), data)).send();
        if (est.hasError()) {
            String msg = est.getError().getMessage();
            String lower = msg == null ? "" : msg.toLowerCase(Locale.ROOT);
            log.error("keeper.gas_estimation_failed tokenCount={} error={}", tokenCount, msg);
            if (lower.contains("execution reverted")) {
                throw new TransactionRevertedException(null,
                        "Reveal simulation reverted: " + msg + ". Check token ids are minted and not yet revealed.");
            }
            if (lower.contains("insufficient funds")) {
                throw new PermanentServiceException("KEEPER_INSUFFICIENT_FUNDS",
                        "Keeper wallet has insufficient balance for gas: " + from);
            }
            throw new TransientServiceException("GAS_ESTIMATION_FAILED", msg);
        }
        return new BigDecimal(est.getAmountUsed())
                .multiply(BigDecimal.valueOf(gasBuffer))
                .setScale(0, RoundingMode.CEILING)
                .toBigInteger();
    }

    static Function revealFunction(List<Long> tokenIds, List<String> metadataUris) {
        List<Uint256> ids = new ArrayList<>(tokenIds.size());
        for (Long id : tokenIds) ids.add(new Uint256(BigInteger.valueOf(id)));
        List<Utf8String> uris = new ArrayList<>(metadataUris.size());
        for (String u : metadataUris) uris.add(new Utf8String(u));

        return new Function("revealTokens",
                List.of(new DynamicArray<>(Uint256.class, ids), new DynamicArray<>(Utf8String.class, uris)),
                List.of());
    }

    private Credentials keeper() {
        Credentials c = keeper;
        if (c != null) return c;
        String key = props.getKeeperPrivateKey();
        if (key == null || key.isBlank()) {
            throw new PermanentServiceException("KEEPER_KEY_MISSING", "app.blockchain.keeper-private-key is not set");
        }
        c = Credentials.create(key.trim());
        keeper = c;
        log.info("keeper.initialized address={} contract={}", c.getAddress(), props.getContractAddress());
        return c;
    }

    private void requireContract() {
        if (props.getContractAddress() == null || props.getContractAddress().isBlank()) {
            throw new PermanentServiceException("CONTRACT_ADDRESS_MISSING", "app.blockchain.contract-address is not set");
        }
    }

    private static void rpcCheck(Response<?> res, String op) {
        if (res.hasError()) {
            throw new TransientServiceException("RPC_ERROR", op + ": " + res.getError().getMessage());
        }
    }

    private static boolean isRetryable(Exception e) {
        return !(e instanceof PermanentServiceException);
    }
}
