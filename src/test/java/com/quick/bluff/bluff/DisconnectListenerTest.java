package com.quick.bluff.bluff;

import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DisconnectListenerTest {

    @Test
    void shouldBroadcastSessionThatLostAPlayer() {
        GameFixture fixture = new GameFixture(13L);
        GameFixture.Table table = fixture.lobbyOfThree();
        GameBroadcaster broadcaster = mock(GameBroadcaster.class);
        DisconnectListener listener = new DisconnectListener(fixture.registry, broadcaster);
        Message<byte[]> message = MessageBuilder.withPayload(new byte[0]).build();

        listener.onDisconnect(new SessionDisconnectEvent(this, message, "conn-carol", CloseStatus.NORMAL));

        verify(broadcaster).publish(argThat(update -> update.view().players().size() == 2));
        assertEquals(2, fixture.registry.view(table.sessionId()).orElseThrow().players().size());
    }
}
