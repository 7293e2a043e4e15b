package com.quick.bluff.bluff;

public record SessionTicket(String sessionId, String playerId) {
}
