package com.quick.bluff.bluff;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
public class Game {
    private String id;
    private List<Player> players = new ArrayList<>();
    private String hostId;
    private boolean started;
    private int currentPlayerIndex;     // whose turn
    private Rank requiredRank = Rank.ACE;
    private List<Card> pile = new ArrayList<>();
    private LastPlay lastPlay;
    private Long challengeDeadlineEpochMs;

    // Peanut Butter: who may redirect the pile, and whether someone else played after them
    private String counterClaimantId;
    private boolean playedSinceClaim;

    public Optional<Player> findPlayer(String playerId) {
        return players.stream()
                .filter(p -> p.getId().equals(playerId))
                .findFirst();
    }

    public int indexOf(String playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId().equals(playerId)) {
                return i;
            }
        }
        return -1;
    }

    public Player currentPlayer() {
        if (players.isEmpty() || currentPlayerIndex >= players.size()) {
            return null;
        }
        return players.get(currentPlayerIndex);
    }
}
