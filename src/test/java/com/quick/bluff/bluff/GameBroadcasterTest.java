package com.quick.bluff.bluff;

import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GameBroadcasterTest {
    private final SimpMessagingTemplate messagingTemplate = mock(SimpMessagingTemplate.class);
    private final GameBroadcaster broadcaster = new GameBroadcaster(messagingTemplate);

    @Test
    void shouldPublishViewToTopicAndHandsToOwners() {
        GameFixture fixture = new GameFixture(3L);
        GameFixture.Table table = fixture.lobbyOfThree();
        GameUpdate update = fixture.registry.start(table.sessionId(), table.alice()).update();

        broadcaster.publish(update);

        verify(messagingTemplate).convertAndSend("/topic/game/" + table.sessionId(), update.view());
        for (HandView hand : update.hands()) {
            verify(messagingTemplate).convertAndSendToUser(
                    eq(hand.connectionId()), eq("/queue/hand"), eq(hand),
                    argThat((Map<String, Object> headers) ->
                            hand.connectionId().equals(headers.get(SimpMessageHeaderAccessor.SESSION_ID_HEADER))));
        }
    }

    @Test
    void shouldSendRejectionOnlyToCaller() {
        broadcaster.rejected("conn-bob", "play", RejectReason.NOT_YOUR_TURN, null);

        verify(messagingTemplate).convertAndSendToUser(
                eq("conn-bob"), eq("/queue/errors"),
                argThat((ErrorPayload payload) -> payload.getReason() == RejectReason.NOT_YOUR_TURN
                        && "play".equals(payload.getAction())),
                anyMap());
        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }

    @Test
    void shouldSkipHandsWithoutConnection() {
        GameUpdate update = new GameUpdate(
                new GameView("s", List.of(), false, null, Rank.ACE, null, 0, null, 4),
                List.of(new HandView("p", null, List.of())));

        broadcaster.publish(update);

        verify(messagingTemplate, never()).convertAndSendToUser(anyString(), anyString(), any(), anyMap());
        assertEquals("/topic/game/s", GameBroadcaster.gameTopic("s"));
    }
}
