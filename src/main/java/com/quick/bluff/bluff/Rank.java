package com.quick.bluff.bluff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card ranks in the order players must claim them: A, 2..10, J, Q, K, then back to A.
 */
public enum Rank {
    ACE("A"),
    TWO("2"),
    THREE("3"),
    FOUR("4"),
    FIVE("5"),
    SIX("6"),
    SEVEN("7"),
    EIGHT("8"),
    NINE("9"),
    TEN("10"),
    JACK("J"),
    QUEEN("Q"),
    KING("K");

    private static final Rank[] CYCLE = values();

    private final String label;

    Rank(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public Rank next() {
        return CYCLE[(ordinal() + 1) % CYCLE.length];
    }

    public static Rank fromLabel(String label) {
        for (Rank rank : CYCLE) {
            if (rank.label.equalsIgnoreCase(label)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + label);
    }
}
