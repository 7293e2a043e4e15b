package com.quick.bluff.bluff;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A player's full hand, delivered only to that player's own connection.
 */
public record HandView(String playerId, @JsonIgnore String connectionId, List<Card> hand) {

    public static HandView of(Player player) {
        return new HandView(player.getId(), player.getConnectionId(), List.copyOf(player.getHand()));
    }
}
