package com.quick.bluff.bluff;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What every member of a session may see. Hands are reduced to card counts.
 */
public record GameView(
        String id,
        List<PlayerView> players,
        boolean started,
        String currentTurnPlayerId,
        Rank currentRequiredRank,
        LastPlayView lastPlay,
        int pileCount,
        Long challengeDeadline,
        int maxPlayable
) {

    public record PlayerView(String id, String name, @JsonProperty("isHost") boolean host, int cardsLeft) {
    }

    public record LastPlayView(String playerName, int count, Rank claimedRank) {
    }

    public static GameView of(Game game) {
        List<PlayerView> players = game.getPlayers().stream()
                .map(p -> new PlayerView(p.getId(), p.getName(), p.isHost(), p.getHand().size()))
                .toList();
        Player current = game.isStarted() ? game.currentPlayer() : null;
        LastPlay play = game.getLastPlay();
        return new GameView(
                game.getId(),
                players,
                game.isStarted(),
                current != null ? current.getId() : null,
                game.getRequiredRank(),
                play != null ? new LastPlayView(play.playerName(), play.count(), play.claimedRank()) : null,
                game.getPile().size(),
                game.getChallengeDeadlineEpochMs(),
                TurnEngine.maxPlayable(game.getPlayers().size())
        );
    }
}
