package com.quick.bluff.bluff;

import lombok.Data;

/**
 * Private answer to create/join, sent only to the requesting connection.
 */
@Data
public class SessionReply {
    private boolean ok;
    private String sessionId;
    private String playerId;
    private RejectReason reason;

    public static SessionReply of(ActionResult<SessionTicket> result) {
        SessionReply reply = new SessionReply();
        reply.setOk(result.accepted());
        reply.setReason(result.reason());
        if (result.value() != null) {
            reply.setSessionId(result.value().sessionId());
            reply.setPlayerId(result.value().playerId());
        }
        return reply;
    }
}
