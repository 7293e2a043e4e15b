package com.quick.bluff.bluff;

/**
 * The most recent accepted play, kept until the pile is settled.
 */
public record LastPlay(String playerId, String playerName, int count, Rank claimedRank) {
}
