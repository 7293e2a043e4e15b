package com.quick.bluff.bluff;

import java.util.List;

/**
 * Public projection plus private hands, captured together under the session lock.
 */
public record GameUpdate(GameView view, List<HandView> hands) {

    public static GameUpdate of(Game game) {
        return new GameUpdate(
                GameView.of(game),
                game.getPlayers().stream().map(HandView::of).toList()
        );
    }
}
