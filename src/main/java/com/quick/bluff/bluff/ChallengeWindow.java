package com.quick.bluff.bluff;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Deadline for calling out the latest play. Checked when a request arrives; nothing fires on expiry.
 */
@Component
public class ChallengeWindow {

    private final Clock clock;
    private final long windowMs;

    public ChallengeWindow(Clock clock,
                           @Value("${bluff.challenge.window-ms:5000}") long windowMs) {
        this.clock = clock;
        this.windowMs = windowMs;
    }

    public void open(Game game) {
        game.setChallengeDeadlineEpochMs(clock.millis() + windowMs);
    }

    public boolean isOpen(Game game) {
        Long deadline = game.getChallengeDeadlineEpochMs();
        return deadline != null && clock.millis() <= deadline;
    }

    public void close(Game game) {
        game.setChallengeDeadlineEpochMs(null);
    }
}
