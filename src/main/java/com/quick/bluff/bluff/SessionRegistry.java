package com.quick.bluff.bluff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns every live session. Each session is mutated only under its own lock,
 * so sessions never wait on each other.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int MIN_PLAYERS_TO_START = 2;

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final TurnEngine turnEngine;
    private final PileSettlement pileSettlement;
    private final int maxPlayers;

    public SessionRegistry(TurnEngine turnEngine,
                           PileSettlement pileSettlement,
                           @Value("${bluff.session.max-players:10}") int maxPlayers) {
        this.turnEngine = turnEngine;
        this.pileSettlement = pileSettlement;
        this.maxPlayers = maxPlayers;
    }

    public ActionResult<SessionTicket> create(String username, String connectionId) {
        Game game = new Game();
        game.setId(UUID.randomUUID().toString());
        Player host = newPlayer(username, connectionId, true);
        game.getPlayers().add(host);
        game.setHostId(host.getId());

        GameSession session = new GameSession(game);
        sessions.put(game.getId(), session);
        log.info("Session {} created by {} ({})", game.getId(), host.getName(), host.getId());
        return session.withLock(g -> ActionResult.accepted(
                new SessionTicket(g.getId(), host.getId()), GameUpdate.of(g)));
    }

    public ActionResult<SessionTicket> join(String sessionId, String username, String connectionId) {
        return execute(sessionId, game -> {
            if (game.isStarted()) {
                return ActionResult.rejected(RejectReason.ALREADY_STARTED);
            }
            if (game.getPlayers().size() >= maxPlayers) {
                return ActionResult.rejected(RejectReason.SESSION_FULL);
            }
            Player player = newPlayer(username, connectionId, false);
            game.getPlayers().add(player);
            log.info("{} ({}) joined session {}", player.getName(), player.getId(), game.getId());
            return ActionResult.accepted(new SessionTicket(game.getId(), player.getId()), GameUpdate.of(game));
        });
    }

    public ActionResult<Void> kick(String sessionId, String targetId, String byId) {
        return execute(sessionId, game -> {
            if (!game.getHostId().equals(byId)) {
                return ActionResult.rejected(RejectReason.NOT_HOST);
            }
            if (game.isStarted()) {
                return ActionResult.rejected(RejectReason.ALREADY_STARTED);
            }
            if (game.getHostId().equals(targetId)) {
                return ActionResult.rejected(RejectReason.CANNOT_KICK_HOST);
            }
            int index = game.indexOf(targetId);
            if (index < 0) {
                return ActionResult.rejected(RejectReason.PLAYER_NOT_FOUND);
            }
            Player kicked = turnEngine.removeSeat(game, index);
            log.info("{} ({}) kicked from session {}", kicked.getName(), kicked.getId(), game.getId());
            return ActionResult.accepted(null, GameUpdate.of(game));
        });
    }

    public ActionResult<Void> start(String sessionId, String byId) {
        return execute(sessionId, game -> {
            if (!game.getHostId().equals(byId)) {
                return ActionResult.rejected(RejectReason.NOT_HOST);
            }
            if (game.isStarted()) {
                return ActionResult.rejected(RejectReason.ALREADY_STARTED);
            }
            if (game.getPlayers().size() < MIN_PLAYERS_TO_START) {
                return ActionResult.rejected(RejectReason.NOT_ENOUGH_PLAYERS);
            }
            game.getPlayers().forEach(p -> p.getHand().clear());
            turnEngine.dealInitial(game.getPlayers(), game.getHostId());
            game.setStarted(true);
            game.setCurrentPlayerIndex((game.indexOf(game.getHostId()) + 1) % game.getPlayers().size());
            game.setRequiredRank(Rank.ACE);
            game.getPile().clear();
            game.setLastPlay(null);
            game.setChallengeDeadlineEpochMs(null);
            pileSettlement.clearEligibility(game);
            log.info("Session {} started with {} players and {} deck(s)",
                    game.getId(), game.getPlayers().size(), DeckFactory.deckCount(game.getPlayers().size()));
            return ActionResult.accepted(null, GameUpdate.of(game));
        });
    }

    /**
     * Removes the player bound to a closed connection from every session holding one.
     * Works from a copy of the session list so it can run alongside other actions.
     *
     * @return a fresh update for each session that lost a player
     */
    public List<GameUpdate> handleDisconnect(String connectionId) {
        List<GameUpdate> updates = new ArrayList<>();
        if (connectionId == null) {
            return updates;
        }
        for (GameSession session : List.copyOf(sessions.values())) {
            GameUpdate update = session.withLock(game -> removeConnection(game, connectionId));
            if (update != null) {
                updates.add(update);
            }
        }
        return updates;
    }

    /**
     * Runs an action with exclusive access to one session.
     */
    public <T> ActionResult<T> execute(String sessionId, Function<Game, ActionResult<T>> action) {
        GameSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return ActionResult.rejected(RejectReason.SESSION_NOT_FOUND);
        }
        return session.withLock(action);
    }

    public Optional<GameView> view(String sessionId) {
        GameSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.of(session.withLock(GameView::of));
    }

    public List<GameView> views() {
        return List.copyOf(sessions.values()).stream()
                .map(session -> session.withLock(GameView::of))
                .toList();
    }

    private GameUpdate removeConnection(Game game, String connectionId) {
        int index = -1;
        for (int i = 0; i < game.getPlayers().size(); i++) {
            if (connectionId.equals(game.getPlayers().get(i).getConnectionId())) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return null;
        }
        Player removed = turnEngine.removeSeat(game, index);
        if (removed.getId().equals(game.getCounterClaimantId())) {
            pileSettlement.clearEligibility(game);
        }
        if (removed.getId().equals(game.getHostId()) && !game.getPlayers().isEmpty()) {
            Player next = game.getPlayers().get(0);
            next.setHost(true);
            game.setHostId(next.getId());
            log.info("Host of session {} passed to {} ({})", game.getId(), next.getName(), next.getId());
        }
        log.info("{} ({}) left session {}, {} player(s) remain",
                removed.getName(), removed.getId(), game.getId(), game.getPlayers().size());
        return GameUpdate.of(game);
    }

    private Player newPlayer(String username, String connectionId, boolean host) {
        Player player = new Player();
        player.setId(UUID.randomUUID().toString());
        player.setName(username == null ? "" : username.strip());
        player.setConnectionId(connectionId);
        player.setHost(host);
        return player;
    }
}
