package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class TurnEngine {

    private final DeckFactory deckFactory;

    /**
     * Ceiling on cards a player may put down in one turn.
     */
    public static int maxPlayable(int playerCount) {
        return DeckFactory.deckCount(playerCount) * Suit.values().length;
    }

    /**
     * Deals a fresh deck one card at a time, starting with the seat after the dealer.
     */
    public void dealInitial(List<Player> players, String dealerId) {
        if (players.isEmpty()) {
            return;
        }
        List<Card> deck = deckFactory.buildDeck(DeckFactory.deckCount(players.size()));
        int dealerIndex = 0;
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId().equals(dealerId)) {
                dealerIndex = i;
                break;
            }
        }
        int startIndex = (dealerIndex + 1) % players.size();
        for (int i = 0; i < deck.size(); i++) {
            players.get((startIndex + i) % players.size()).getHand().add(deck.get(i));
        }
    }

    public void advanceTurn(Game game) {
        if (game.getPlayers().isEmpty()) {
            return;
        }
        game.setCurrentPlayerIndex((game.getCurrentPlayerIndex() + 1) % game.getPlayers().size());
    }

    public void advanceRank(Game game) {
        game.setRequiredRank(game.getRequiredRank().next());
    }

    /**
     * Removes a seat and keeps the turn pointer on a player who is still seated.
     * If the removed seat held the turn, it passes to whoever now sits there.
     */
    public Player removeSeat(Game game, int index) {
        List<Player> players = game.getPlayers();
        Player removed = players.remove(index);
        if (players.isEmpty()) {
            game.setCurrentPlayerIndex(0);
            return removed;
        }
        int current = game.getCurrentPlayerIndex();
        if (index < current) {
            current--;
        }
        game.setCurrentPlayerIndex(current % players.size());
        return removed;
    }
}
