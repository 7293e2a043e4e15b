package com.quick.bluff.bluff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A single playing card. On the wire a card is its short code, e.g. {@code "10H"} or {@code "QS"}.
 */
public record Card(Rank rank, Suit suit) {

    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
    }

    @JsonValue
    public String code() {
        return rank.getLabel() + suit.getSymbol();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Card fromCode(String code) {
        if (code == null || code.length() < 2) {
            throw new IllegalArgumentException("Invalid card: " + code);
        }
        String rank = code.substring(0, code.length() - 1);
        String suit = code.substring(code.length() - 1);
        return new Card(Rank.fromLabel(rank), Suit.fromSymbol(suit));
    }

    @Override
    public String toString() {
        return code();
    }
}
