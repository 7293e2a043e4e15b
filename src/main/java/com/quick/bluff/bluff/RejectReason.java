package com.quick.bluff.bluff;

public enum RejectReason {
    SESSION_NOT_FOUND,
    SESSION_FULL,
    ALREADY_STARTED,
    NOT_STARTED,
    NOT_HOST,
    NOT_ENOUGH_PLAYERS,
    PLAYER_NOT_FOUND,
    CANNOT_KICK_HOST,
    NOT_YOUR_TURN,
    INVALID_CARD_COUNT,
    INVALID_CLAIM,
    CARD_NOT_IN_HAND,
    NO_PLAY_TO_CHALLENGE,
    CHALLENGE_WINDOW_CLOSED,
    COUNTER_NOT_ALLOWED
}
