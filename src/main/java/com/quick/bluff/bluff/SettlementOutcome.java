package com.quick.bluff.bluff;

/**
 * Who picked up the pile and why.
 *
 * @param claimTruthful for a challenge, whether the challenged cards matched the claim; always false for a counter
 */
public record SettlementOutcome(Kind kind, String receiverId, int cardsTaken, boolean claimTruthful) {

    public enum Kind {
        CHALLENGE,
        COUNTER
    }
}
