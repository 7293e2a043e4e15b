package com.quick.bluff.bluff;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Suit {
    SPADES("S"),
    HEARTS("H"),
    DIAMONDS("D"),
    CLUBS("C");

    private final String symbol;

    Suit(String symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public static Suit fromSymbol(String symbol) {
        return switch (symbol.toUpperCase()) {
            case "S" -> SPADES;
            case "H" -> HEARTS;
            case "D" -> DIAMONDS;
            case "C" -> CLUBS;
            default -> throw new IllegalArgumentException("Unknown suit: " + symbol);
        };
    }
}
