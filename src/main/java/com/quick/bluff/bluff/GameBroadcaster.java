package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes game state out: the public view to the session topic, each hand to its owner's connection.
 */
@Component
@RequiredArgsConstructor
public class GameBroadcaster {

    static final String HAND_QUEUE = "/queue/hand";
    static final String SESSION_QUEUE = "/queue/session";
    static final String ERROR_QUEUE = "/queue/errors";

    private final SimpMessagingTemplate messagingTemplate;

    public static String gameTopic(String sessionId) {
        return "/topic/game/" + sessionId;
    }

    public void publish(GameUpdate update) {
        messagingTemplate.convertAndSend(gameTopic(update.view().id()), update.view());
        for (HandView hand : update.hands()) {
            sendToConnection(hand.connectionId(), HAND_QUEUE, hand);
        }
    }

    public void reply(String connectionId, SessionReply reply) {
        sendToConnection(connectionId, SESSION_QUEUE, reply);
    }

    public void rejected(String connectionId, String action, RejectReason reason, String message) {
        ErrorPayload payload = new ErrorPayload();
        payload.setAction(action);
        payload.setReason(reason);
        payload.setMessage(message);
        sendToConnection(connectionId, ERROR_QUEUE, payload);
    }

    // Clients connect anonymously, so the STOMP session id stands in for the user.
    private void sendToConnection(String connectionId, String destination, Object payload) {
        if (connectionId == null) {
            return;
        }
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(connectionId, destination, payload, accessor.getMessageHeaders());
    }
}
