package com.quick.bluff.bluff;

import lombok.Data;

import java.util.List;

@Data
public class PlayMessage {
    private String sessionId;
    private String playerId;
    private List<Card> cards;
    private Rank claimedRank;
}
