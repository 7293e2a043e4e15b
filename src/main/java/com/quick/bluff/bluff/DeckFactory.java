package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

@Component
@RequiredArgsConstructor
public class DeckFactory {

    public static final int CARDS_PER_DECK = 52;
    private static final int PLAYERS_PER_DECK = 5;

    private final Random random;

    /**
     * One standard deck per five players, never fewer than one.
     */
    public static int deckCount(int playerCount) {
        return Math.max(1, (playerCount + PLAYERS_PER_DECK - 1) / PLAYERS_PER_DECK);
    }

    /**
     * Builds {@code deckCount} standard decks and shuffles them together.
     */
    public List<Card> buildDeck(int deckCount) {
        List<Card> deck = new ArrayList<>(deckCount * CARDS_PER_DECK);
        for (int d = 0; d < deckCount; d++) {
            for (Rank rank : Rank.values()) {
                for (Suit suit : Suit.values()) {
                    deck.add(new Card(rank, suit));
                }
            }
        }
        Collections.shuffle(deck, random);
        return deck;
    }
}
