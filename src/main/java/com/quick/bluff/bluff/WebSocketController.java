package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
@Slf4j
public class WebSocketController {

    private static final String CONNECTION_HEADER = SimpMessageHeaderAccessor.SESSION_ID_HEADER;

    private final SessionRegistry sessionRegistry;
    private final GameService gameService;
    private final GameBroadcaster broadcaster;

    /**
     * Client sends a SessionMessage with a username to /app/session/create
     */
    @MessageMapping("/session/create")
    public void createSession(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        ActionResult<SessionTicket> result = sessionRegistry.create(message.getUsername(), connectionId);
        broadcaster.reply(connectionId, SessionReply.of(result));
        broadcaster.publish(result.update());
    }

    @MessageMapping("/session/join")
    public void joinSession(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        ActionResult<SessionTicket> result =
                sessionRegistry.join(message.getSessionId(), message.getUsername(), connectionId);
        broadcaster.reply(connectionId, SessionReply.of(result));
        if (result.accepted()) {
            broadcaster.publish(result.update());
        } else {
            log.debug("join of {} rejected: {}", message.getSessionId(), result.reason());
        }
    }

    @MessageMapping("/session/kick")
    public void kickPlayer(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        dispatch("kick", connectionId, sessionRegistry.kick(
                message.getSessionId(), message.getTargetPlayerId(), message.getPlayerId()));
    }

    @MessageMapping("/game/start")
    public void startGame(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        dispatch("start", connectionId, sessionRegistry.start(message.getSessionId(), message.getPlayerId()));
    }

    @MessageMapping("/game/play")
    public void play(PlayMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        dispatch("play", connectionId, gameService.play(
                message.getSessionId(), message.getPlayerId(), message.getCards(), message.getClaimedRank()));
    }

    @MessageMapping("/game/challenge")
    public void challenge(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        dispatch("challenge", connectionId, gameService.callChallenge(message.getSessionId(), message.getPlayerId()));
    }

    @MessageMapping("/game/counter")
    public void counter(SessionMessage message, @Header(CONNECTION_HEADER) String connectionId) {
        dispatch("counter", connectionId, gameService.invokeCounter(message.getSessionId(), message.getPlayerId()));
    }

    /**
     * Malformed payloads (unknown card code, unknown rank) end up here.
     */
    @MessageExceptionHandler
    public void handleException(RuntimeException e, @Header(CONNECTION_HEADER) String connectionId) {
        log.warn("Rejected malformed message from {}: {}", connectionId, e.getMessage());
        broadcaster.rejected(connectionId, null, null, e.getMessage());
    }

    // A rejection goes back to the caller only; the session sees nothing.
    private void dispatch(String action, String connectionId, ActionResult<?> result) {
        if (result.accepted()) {
            broadcaster.publish(result.update());
            return;
        }
        log.debug("{} from {} rejected: {}", action, connectionId, result.reason());
        broadcaster.rejected(connectionId, action, result.reason(), null);
    }
}
