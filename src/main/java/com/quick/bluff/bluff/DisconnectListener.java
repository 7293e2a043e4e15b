package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@RequiredArgsConstructor
@Slf4j
public class DisconnectListener {

    private final SessionRegistry sessionRegistry;
    private final GameBroadcaster broadcaster;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        log.debug("Connection {} closed ({})", event.getSessionId(), event.getCloseStatus());
        for (GameUpdate update : sessionRegistry.handleDisconnect(event.getSessionId())) {
            broadcaster.publish(update);
        }
    }
}
