package com.quick.bluff.bluff;

import lombok.Data;

@Data
public class SessionMessage {
    private String sessionId;
    private String playerId;        // who is acting
    private String targetPlayerId;  // kick only
    private String username;        // create / join only
}
