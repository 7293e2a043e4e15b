package com.quick.bluff.bluff;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final SessionRegistry sessionRegistry;
    private final TurnEngine turnEngine;
    private final ChallengeWindow challengeWindow;
    private final PileSettlement pileSettlement;

    /**
     * Puts cards face down on the pile under a claimed rank. The claim is not checked here;
     * that is what challenges are for.
     */
    public ActionResult<LastPlay> play(String sessionId, String playerId, List<Card> cards, Rank claimedRank) {
        return sessionRegistry.execute(sessionId, game -> {
            if (!game.isStarted()) {
                return ActionResult.rejected(RejectReason.NOT_STARTED);
            }
            Player current = game.currentPlayer();
            if (current == null || !current.getId().equals(playerId)) {
                return ActionResult.rejected(RejectReason.NOT_YOUR_TURN);
            }
            int maxPlayable = TurnEngine.maxPlayable(game.getPlayers().size());
            if (cards == null || cards.isEmpty() || cards.size() > maxPlayable) {
                return ActionResult.rejected(RejectReason.INVALID_CARD_COUNT);
            }
            if (claimedRank == null) {
                return ActionResult.rejected(RejectReason.INVALID_CLAIM);
            }
            // duplicates must be backed by as many copies in hand
            List<Card> remaining = new ArrayList<>(current.getHand());
            for (Card card : cards) {
                if (!remaining.remove(card)) {
                    return ActionResult.rejected(RejectReason.CARD_NOT_IN_HAND);
                }
            }

            current.setHand(remaining);
            game.getPile().addAll(cards);
            pileSettlement.trackPlay(game, current.getId());
            LastPlay play = new LastPlay(current.getId(), current.getName(), cards.size(), claimedRank);
            game.setLastPlay(play);
            challengeWindow.open(game);
            turnEngine.advanceTurn(game);
            turnEngine.advanceRank(game);

            log.debug("Session {}: {} played {} card(s) as {}", game.getId(), current.getName(),
                    cards.size(), claimedRank.getLabel());
            return ActionResult.accepted(play, GameUpdate.of(game));
        });
    }

    public ActionResult<SettlementOutcome> callChallenge(String sessionId, String playerId) {
        return sessionRegistry.execute(sessionId, game -> {
            if (!game.isStarted()) {
                return ActionResult.rejected(RejectReason.NOT_STARTED);
            }
            LastPlay play = game.getLastPlay();
            if (play == null) {
                return ActionResult.rejected(RejectReason.NO_PLAY_TO_CHALLENGE);
            }
            if (!challengeWindow.isOpen(game)) {
                return ActionResult.rejected(RejectReason.CHALLENGE_WINDOW_CLOSED);
            }
            Player challenger = game.findPlayer(playerId).orElse(null);
            Player actor = game.findPlayer(play.playerId()).orElse(null);
            if (challenger == null || actor == null) {
                return ActionResult.rejected(RejectReason.PLAYER_NOT_FOUND);
            }

            SettlementOutcome outcome = pileSettlement.settleChallenge(game, challenger, actor);
            log.info("Session {}: {} challenged {} claiming {}; claim was {}, {} card(s) to {}",
                    game.getId(), challenger.getName(), actor.getName(), play.claimedRank().getLabel(),
                    outcome.claimTruthful() ? "true" : "false", outcome.cardsTaken(),
                    outcome.claimTruthful() ? challenger.getName() : actor.getName());
            return ActionResult.accepted(outcome, GameUpdate.of(game));
        });
    }

    /**
     * Peanut Butter: the player of the previous play hands the pile to whoever played after them.
     */
    public ActionResult<SettlementOutcome> invokeCounter(String sessionId, String playerId) {
        return sessionRegistry.execute(sessionId, game -> {
            if (!game.isStarted()) {
                return ActionResult.rejected(RejectReason.NOT_STARTED);
            }
            if (!pileSettlement.canCounter(game, playerId)) {
                return ActionResult.rejected(RejectReason.COUNTER_NOT_ALLOWED);
            }
            Player receiver = game.findPlayer(game.getLastPlay().playerId()).orElse(null);
            if (receiver == null) {
                return ActionResult.rejected(RejectReason.PLAYER_NOT_FOUND);
            }

            SettlementOutcome outcome = pileSettlement.settleCounter(game, receiver);
            log.info("Session {}: counter-challenge by {}, {} card(s) to {}",
                    game.getId(), playerId, outcome.cardsTaken(), receiver.getName());
            return ActionResult.accepted(outcome, GameUpdate.of(game));
        });
    }
}
