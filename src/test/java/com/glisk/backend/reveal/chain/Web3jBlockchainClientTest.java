package com.glisk.backend.reveal.chain;

import com.glisk.backend.common.error.BlockchainConnectionException;
import com.glisk.backend.common.error.PermanentServiceException;
import com.glisk.backend.common.error.TransactionRevertedException;
import com.glisk.backend.common.error.TransientServiceException;
import com.glisk.backend.reveal.config.BlockchainProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** JSON-RPC node faked with WireMock, one stub per RPC method. */
class Web3jBlockchainClientTest {

    // well-known local devnet key, holds nothing anywhere real
    private static final String KEEPER_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final String CONTRACT = "0x2222222222222222222222222222222222222222";
    private static final String TX = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060";

    static WireMockServer wm;

    private Web3j web3j;
    private BlockchainProperties props;
    private Web3jBlockchainClient client;

    @BeforeAll
    static void startWireMock() {
        wm = new WireMockServer(0);
        wm.start();
    }

    @AfterAll
    static void stopWireMock() {
        if (wm != null) wm.stop();
    }

    @BeforeEach
    void setUp() {
        wm.resetAll();

        props = new BlockchainProperties();
        props.setRpcUrl("http://localhost:" + wm.port() + "/");
        props.setContractAddress(CONTRACT);
        props.setKeeperPrivateKey(KEEPER_KEY);
        props.setRpcInitialDelay(Duration.ofMillis(1));
        props.setReceiptPollInterval(Duration.ofMillis(10));

        web3j = Web3j.build(new HttpService(props.getRpcUrl()));
        client = new Web3jBlockchainClient(web3j, props);
    }

    @AfterEach
    void tearDown() {
        web3j.shutdown();
    }

    private static void rpc(String method, String resultJson) {
        wm.stubFor(post(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo(method)))
                .willReturn(okJson("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + resultJson + "}")));
    }

    private static void rpcError(String method, String message) {
        wm.stubFor(post(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo(method)))
                .willReturn(okJson("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"" + message + "\"}}")));
    }

    private static String receipt(String status) {
        return """
                {"transactionHash":"%s","blockNumber":"0x1e240","gasUsed":"0x33450","status":"%s",
                 "logs":[],"cumulativeGasUsed":"0x33450","transactionIndex":"0x0"}
                """.formatted(TX, status);
    }

    @Test
    void reads_next_token_id() {
        rpc("eth_call", "\"0x000000000000000000000000000000000000000000000000000000000000000b\"");

        assertThat(client.readNextTokenId()).isEqualTo(11L);
    }

    @Test
    void unreachable_node_raises_connection_error_after_retries() {
        rpcError("eth_call", "header not found");

        assertThatThrownBy(() -> client.readNextTokenId()).isInstanceOf(BlockchainConnectionException.class);
        wm.verify(props.getRpcMaxAttempts(), postRequestedFor(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo("eth_call"))));
    }

    @Test
    void empty_call_result_means_no_contract() {
        rpc("eth_call", "\"0x\"");

        assertThatThrownBy(() -> client.readNextTokenId())
                .isInstanceOfSatisfying(PermanentServiceException.class,
                        e -> assertThat(e.code()).isEqualTo("CONTRACT_NOT_FOUND"));
    }

    @Test
    void submits_signed_reveal_transaction() {
        rpc("eth_estimateGas", "\"0x30d40\"");
        rpc("eth_maxPriorityFeePerGas", "\"0x3b9aca00\"");
        rpc("eth_getBlockByNumber", "{\"number\":\"0x10\",\"baseFeePerGas\":\"0x77359400\",\"transactions\":[],\"uncles\":[]}");
        rpc("eth_getTransactionCount", "\"0x7\"");
        rpc("eth_sendRawTransaction", "\"" + TX + "\"");

        RevealHandle h = client.submitBatchReveal(List.of(12L, 13L), List.of("ipfs://a", "ipfs://b"),
                GasStrategy.MEDIUM, 1.2);

        assertThat(h.txHash()).isEqualTo(TX);
        assertThat(h.tokenIds()).containsExactly(12L, 13L);
        assertThat(h.nonce()).isEqualTo(BigInteger.valueOf(7));
        wm.verify(postRequestedFor(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo("eth_sendRawTransaction"))));
    }

    @Test
    void reverting_simulation_is_not_sent() {
        rpcError("eth_estimateGas", "execution reverted: token already revealed");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.FAST, 1.2))
                .isInstanceOf(TransactionRevertedException.class);
        wm.verify(0, postRequestedFor(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo("eth_sendRawTransaction"))));
    }

    @Test
    void fee_lookup_rpc_error_is_transient_and_not_sent() {
        rpc("eth_estimateGas", "\"0x30d40\"");
        rpcError("eth_maxPriorityFeePerGas", "method not supported");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.MEDIUM, 1.2))
                .isInstanceOfSatisfying(TransientServiceException.class,
                        e -> assertThat(e.code()).isEqualTo("RPC_ERROR"));
        wm.verify(0, postRequestedFor(urlEqualTo("/"))
                .withRequestBody(matchingJsonPath("$.method", equalTo("eth_sendRawTransaction"))));
    }

    @Test
    void nonce_lookup_rpc_error_is_transient() {
        rpc("eth_estimateGas", "\"0x30d40\"");
        rpc("eth_maxPriorityFeePerGas", "\"0x3b9aca00\"");
        rpc("eth_getBlockByNumber", "{\"number\":\"0x10\",\"baseFeePerGas\":\"0x77359400\",\"transactions\":[],\"uncles\":[]}");
        rpcError("eth_getTransactionCount", "header not found");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.MEDIUM, 1.2))
                .isInstanceOf(TransientServiceException.class);
    }

    @Test
    void undecodable_node_answer_is_a_connection_error() {
        rpc("eth_estimateGas", "\"0x30d40\"");
        rpc("eth_maxPriorityFeePerGas", "\"not-a-quantity\"");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.MEDIUM, 1.2))
                .isInstanceOf(BlockchainConnectionException.class);
    }

    @Test
    void empty_keeper_wallet_is_permanent() {
        rpcError("eth_estimateGas", "insufficient funds for gas * price + value");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.SLOW, 1.2))
                .isInstanceOfSatisfying(PermanentServiceException.class,
                        e -> assertThat(e.code()).isEqualTo("KEEPER_INSUFFICIENT_FUNDS"));
    }

    @Test
    void missing_keeper_key_is_permanent() {
        props.setKeeperPrivateKey(" ");

        assertThatThrownBy(() -> client.submitBatchReveal(List.of(12L), List.of("ipfs://a"), GasStrategy.MEDIUM, 1.2))
                .isInstanceOfSatisfying(PermanentServiceException.class,
                        e -> assertThat(e.code()).isEqualTo("KEEPER_KEY_MISSING"));
    }

    @Test
    void mismatched_batch_is_rejected() {
        assertThatThrownBy(() -> client.submitBatchReveal(List.of(1L, 2L), List.of("ipfs://a"), GasStrategy.MEDIUM, 1.2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void successful_receipt_confirms() {
        rpc("eth_getTransactionReceipt", receipt("0x1"));

        ConfirmationResult r = client.waitForConfirmation(new RevealHandle(TX, List.of(1L), BigInteger.ONE), Duration.ofSeconds(2));

        assertThat(r.outcome()).isEqualTo(ConfirmationResult.Outcome.CONFIRMED);
        assertThat(r.blockNumber()).isEqualTo(123456L);
        assertThat(r.gasUsed()).isEqualTo(210000L);
    }

    @Test
    void failed_receipt_is_a_revert() {
        rpc("eth_getTransactionReceipt", receipt("0x0"));

        ConfirmationResult r = client.waitForConfirmation(new RevealHandle(TX, List.of(1L), BigInteger.ONE), Duration.ofSeconds(2));

        assertThat(r.outcome()).isEqualTo(ConfirmationResult.Outcome.REVERTED);
    }

    @Test
    void no_receipt_before_deadline_is_a_timeout() {
        rpc("eth_getTransactionReceipt", "null");

        ConfirmationResult r = client.waitForConfirmation(new RevealHandle(TX, List.of(1L), BigInteger.ONE), Duration.ofMillis(100));

        assertThat(r.outcome()).isEqualTo(ConfirmationResult.Outcome.TIMEOUT);
        assertThat(client.findReceipt(TX)).isEqualTo(Optional.empty());
    }

    @Test
    void reveal_call_uses_contract_signature() {
        Function fn = Web3jBlockchainClient.revealFunction(List.of(1L, 2L), List.of("ipfs://x", "ipfs://y"));

        assertThat(fn.getName()).isEqualTo("revealTokens");
        assertThat(fn.getInputParameters()).hasSize(2);
        assertThat(FunctionEncoder.encode(fn))
                .startsWith(FunctionEncoder.buildMethodId("revealTokens(uint256[],string[])"));
    }
}
