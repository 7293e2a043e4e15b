package com.quick.bluff.bluff;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TurnEngineTest {
    private final TurnEngine turnEngine = new TurnEngine(new DeckFactory(new Random(9L)));

    @Test
    void shouldDealWholeDeckEvenlyForTwoToTenPlayers() {
        for (int n = 2; n <= 10; n++) {
            List<Player> players = players(n);
            turnEngine.dealInitial(players, players.get(0).getId());

            int total = players.stream().mapToInt(p -> p.getHand().size()).sum();
            int min = players.stream().mapToInt(p -> p.getHand().size()).min().orElseThrow();
            int max = players.stream().mapToInt(p -> p.getHand().size()).max().orElseThrow();
            assertEquals(52 * ((n + 4) / 5), total, "players=" + n);
            assertTrue(max - min <= 1, "players=" + n);
        }
    }

    @Test
    void shouldStartDealingAfterDealer() {
        List<Player> players = players(3);

        turnEngine.dealInitial(players, players.get(0).getId());

        // 52 = 3 * 17 + 1, the extra card lands on the first seat dealt to
        assertEquals(17, players.get(0).getHand().size());
        assertEquals(18, players.get(1).getHand().size());
        assertEquals(17, players.get(2).getHand().size());
    }

    @Test
    void shouldDealAfterLastSeatDealerFromSeatZero() {
        List<Player> players = players(3);

        turnEngine.dealInitial(players, players.get(2).getId());

        assertEquals(18, players.get(0).getHand().size());
    }

    @Test
    void shouldCapPlayByDeckCount() {
        assertEquals(4, TurnEngine.maxPlayable(2));
        assertEquals(4, TurnEngine.maxPlayable(5));
        assertEquals(8, TurnEngine.maxPlayable(6));
        assertEquals(8, TurnEngine.maxPlayable(10));
    }

    @Test
    void shouldCycleRequiredRankThroughThirteenValues() {
        Game game = new Game();
        List<Rank> seen = new ArrayList<>();
        for (int i = 0; i < 13; i++) {
            seen.add(game.getRequiredRank());
            turnEngine.advanceRank(game);
        }

        assertEquals(List.of(Rank.values()), seen);
        assertEquals(Rank.ACE, game.getRequiredRank());
    }

    @Test
    void shouldWrapTurnAfterLastPlayer() {
        Game game = new Game();
        game.getPlayers().addAll(players(3));
        game.setCurrentPlayerIndex(2);

        turnEngine.advanceTurn(game);

        assertEquals(0, game.getCurrentPlayerIndex());
    }

    @Test
    void shouldKeepTurnOnSamePlayerWhenEarlierSeatLeaves() {
        Game game = new Game();
        game.getPlayers().addAll(players(4));
        game.setCurrentPlayerIndex(2);
        String current = game.currentPlayer().getId();

        turnEngine.removeSeat(game, 0);

        assertEquals(current, game.currentPlayer().getId());
    }

    @Test
    void shouldPassTurnWhenCurrentSeatLeaves() {
        Game game = new Game();
        game.getPlayers().addAll(players(3));
        game.setCurrentPlayerIndex(2);

        turnEngine.removeSeat(game, 2);

        assertEquals(0, game.getCurrentPlayerIndex());
        assertEquals("p0", game.currentPlayer().getId());
    }

    @Test
    void shouldResetTurnWhenLastSeatLeaves() {
        Game game = new Game();
        game.getPlayers().addAll(players(1));

        turnEngine.removeSeat(game, 0);

        assertEquals(0, game.getCurrentPlayerIndex());
        assertNull(game.currentPlayer());
    }

    private static List<Player> players(int count) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Player player = new Player();
            player.setId("p" + i);
            player.setName("player" + i);
            players.add(player);
        }
        return players;
    }
}
