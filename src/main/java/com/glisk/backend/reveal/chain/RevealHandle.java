package com.glisk.backend.reveal.chain;

import java.math.BigInteger;
import java.util.List;

/** A submitted, not yet confirmed batch reveal. */
public record RevealHandle(String txHash, List<Long> tokenIds, BigInteger nonce) {}
