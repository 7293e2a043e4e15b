package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class PileSettlement {

    private final ChallengeWindow challengeWindow;

    /**
     * True iff every card put down by the last play carries the claimed rank.
     * Those cards are the tail of the pile, as long as the play's count.
     */
    public boolean isTruthful(Game game) {
        LastPlay play = game.getLastPlay();
        List<Card> pile = game.getPile();
        int from = Math.max(0, pile.size() - play.count());
        return pile.subList(from, pile.size()).stream()
                .allMatch(card -> card.rank() == play.claimedRank());
    }

    /**
     * Resolves a challenge: the liar takes the pile, or the challenger does if the claim held.
     */
    public SettlementOutcome settleChallenge(Game game, Player challenger, Player actor) {
        boolean truthful = isTruthful(game);
        Player receiver = truthful ? challenger : actor;
        int taken = transferPile(game, receiver);
        return new SettlementOutcome(SettlementOutcome.Kind.CHALLENGE, receiver.getId(), taken, truthful);
    }

    /**
     * Slides counter eligibility after a play by {@code actorId}. Must run before the new play
     * replaces {@link Game#getLastPlay()}: the previous play's actor becomes the claimant.
     */
    public void trackPlay(Game game, String actorId) {
        LastPlay previous = game.getLastPlay();
        String claimant = previous == null ? null : previous.playerId();
        game.setCounterClaimantId(claimant);
        game.setPlayedSinceClaim(claimant != null && !claimant.equals(actorId));
    }

    public boolean canCounter(Game game, String callerId) {
        return game.getLastPlay() != null
                && game.getCounterClaimantId() != null
                && game.isPlayedSinceClaim()
                && game.getCounterClaimantId().equals(callerId);
    }

    /**
     * Peanut Butter: the pile goes to whoever made the latest play, not to the caller.
     */
    public SettlementOutcome settleCounter(Game game, Player receiver) {
        clearEligibility(game);
        int taken = transferPile(game, receiver);
        return new SettlementOutcome(SettlementOutcome.Kind.COUNTER, receiver.getId(), taken, false);
    }

    public void clearEligibility(Game game) {
        game.setCounterClaimantId(null);
        game.setPlayedSinceClaim(false);
    }

    private int transferPile(Game game, Player receiver) {
        int taken = game.getPile().size();
        receiver.getHand().addAll(game.getPile());
        game.getPile().clear();
        game.setLastPlay(null);
        challengeWindow.close(game);
        clearEligibility(game);
        return taken;
    }
}
