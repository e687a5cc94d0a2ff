package com.glisk.backend.token.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Token lifecycle.
 * <pre>
 * DETECTED -> GENERATING -> UPLOADING -> READY -> REVEALED
 * GENERATING -> FAILED, UPLOADING -> FAILED
 * GENERATING -> DETECTED   (transient retry)
 * FAILED -> DETECTED       (operator reset)
 * </pre>
 */
public enum TokenStatus {
    DETECTED,
    GENERATING,
    UPLOADING,
    READY,
    REVEALED,
    FAILED;

    public Set<TokenStatus> successors() {
        return switch (this) {
            case DETECTED -> EnumSet.of(GENERATING);
            case GENERATING -> EnumSet.of(UPLOADING, FAILED, DETECTED);
            case UPLOADING -> EnumSet.of(READY, FAILED);
            case READY -> EnumSet.of(REVEALED);
            case REVEALED -> EnumSet.noneOf(TokenStatus.class);
            case FAILED -> EnumSet.of(DETECTED);
        };
    }

    public boolean canMoveTo(TokenStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return this == REVEALED || this == FAILED;
    }
}
