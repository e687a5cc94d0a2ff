package com.glisk.backend.reveal.chain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/** Scales the node's suggested priority fee. */
public enum GasStrategy {
    FAST(new BigDecimal("1.5")),
    MEDIUM(BigDecimal.ONE),
    SLOW(new BigDecimal("0.8"));

    private final BigDecimal priorityMultiplier;

    GasStrategy(BigDecimal priorityMultiplier) {
        this.priorityMultiplier = priorityMultiplier;
    }

    public BigInteger applyTo(BigInteger priorityFee, double buffer) {
        return new BigDecimal(priorityFee)
                .multiply(priorityMultiplier)
                .multiply(BigDecimal.valueOf(buffer))
                .setScale(0, RoundingMode.CEILING)
                .toBigInteger();
    }
}
