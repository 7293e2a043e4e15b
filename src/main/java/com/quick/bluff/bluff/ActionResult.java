package com.quick.bluff.bluff;

/**
 * Outcome of an inbound action. A rejected action changed nothing and must not be broadcast;
 * an accepted one carries the state captured right after the change.
 */
public record ActionResult<T>(boolean accepted, RejectReason reason, T value, GameUpdate update) {

    public static <T> ActionResult<T> accepted(T value, GameUpdate update) {
        return new ActionResult<>(true, null, value, update);
    }

    public static <T> ActionResult<T> rejected(RejectReason reason) {
        return new ActionResult<>(false, reason, null, null);
    }
}
