package com.quick.bluff.bluff;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A game plus the lock every read and write of it goes through.
 */
final class GameSession {

    private final Game game;
    private final ReentrantLock lock = new ReentrantLock();

    GameSession(Game game) {
        this.game = game;
    }

    <R> R withLock(Function<Game, R> action) {
        lock.lock();
        try {
            return action.apply(game);
        } finally {
            lock.unlock();
        }
    }
}
