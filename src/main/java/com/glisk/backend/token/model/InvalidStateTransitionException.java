package com.glisk.backend.token.model;

public class InvalidStateTransitionException extends RuntimeException {

    private final long tokenId;
    private final TokenStatus from;
    private final TokenStatus to;

    public InvalidStateTransitionException(long tokenId, TokenStatus from, TokenStatus to) {
        super("INVALID_STATE_TRANSITION token=" + tokenId + " " + from + " -> " + to);
        this.tokenId = tokenId;
        this.from = from;
        this.to = to;
    }

    public long tokenId() { return tokenId; }
    public TokenStatus from() { return from; }
    public TokenStatus to() { return to; }
}
