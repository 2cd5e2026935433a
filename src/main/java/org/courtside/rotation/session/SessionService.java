package org.courtside.rotation.session;

import com.google.common.collect.ImmutableList;
import org.courtside.rotation.config.SchedulerProperties;
import org.courtside.rotation.ledger.CostAdjustment;
import org.courtside.rotation.ledger.CostCalculator;
import org.courtside.rotation.ledger.Ledger;
import org.courtside.rotation.ledger.PlayerAccount;
import org.courtside.rotation.ledger.SessionBreakdown;
import org.courtside.rotation.ledger.SessionCosts;
import org.courtside.rotation.scheduler.Candidate;
import org.courtside.rotation.scheduler.GeneratedQueue;
import org.courtside.rotation.scheduler.MatchRecord;
import org.courtside.rotation.scheduler.MatchStatus;
import org.courtside.rotation.scheduler.Participant;
import org.courtside.rotation.scheduler.QueueBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs club sessions: who is playing, the game queue and its lifecycle, and settling costs
 * through the ledger when the session ends.
 *
 * <p>Every mutation is saved to the {@link SessionStore} and broadcast through the
 * {@link SessionUpdatePublisher}. Methods are synchronized so concurrent requests see a
 * consistent session.
 */
@Service
public class SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    private final SessionStore store;
    private final Ledger ledger;
    private final QueueBuilder queueBuilder;
    private final SessionUpdatePublisher publisher;
    private final int maxActiveParticipants;

    @Autowired
    public SessionService(SessionStore store, Ledger ledger, QueueBuilder queueBuilder,
                          SessionUpdatePublisher publisher, SchedulerProperties properties) {
        this(store, ledger, queueBuilder, publisher, properties.maxActiveParticipants());
    }

    public SessionService(SessionStore store, Ledger ledger, QueueBuilder queueBuilder,
                          SessionUpdatePublisher publisher, int maxActiveParticipants) {
        this.store = store;
        this.ledger = ledger;
        this.queueBuilder = queueBuilder;
        this.publisher = publisher;
        this.maxActiveParticipants = maxActiveParticipants;
    }

    public synchronized Session createSession(LocalDate date) {
        Session session = Session.start(UUID.randomUUID().toString(), date);
        save(session);
        logger.info("Created session {} for {}", session.id(), date);
        return session;
    }

    public synchronized Session getSession(String sessionId) {
        try {
            return store.load(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session not found: " + sessionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read session " + sessionId, e);
        }
    }

    public synchronized List<Session> listSessions() {
        try {
            return store.list();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list sessions", e);
        }
    }

    /**
     * Adds a registered player to the session as active.
     */
    public synchronized Session addPlayer(String sessionId, String playerId) {
        Session session = requireInProgress(sessionId);
        ledger.requireAccount(playerId);
        if (session.player(playerId).isPresent()) {
            throw new SessionStateException("Player " + playerId + " is already in session " + sessionId);
        }
        List<SessionPlayer> players = new ArrayList<>(session.players());
        players.add(new SessionPlayer(playerId, PlayerStatus.ACTIVE));
        return saveAndPublish(session.withPlayers(players));
    }

    /**
     * Switches a player between active and left. A player who leaves is removed from every
     * game still waiting in the queue.
     */
    public synchronized Session togglePlayerStatus(String sessionId, String playerId) {
        Session session = requireInProgress(sessionId);
        SessionPlayer current = session.player(playerId)
            .orElseThrow(() -> new SessionNotFoundException(
                "Player " + playerId + " is not in session " + sessionId));
        PlayerStatus newStatus = current.status().toggled();

        List<SessionPlayer> players = session.players().stream()
            .map(p -> p.playerId().equals(playerId) ? new SessionPlayer(playerId, newStatus) : p)
            .toList();
        List<SessionGame> games = session.games();
        if (newStatus == PlayerStatus.LEFT) {
            games = games.stream()
                .filter(g -> !(g.status() == MatchStatus.QUEUED && g.match().involves(playerId)))
                .toList();
            int dropped = session.games().size() - games.size();
            if (dropped > 0) {
                logger.info("Player {} left session {}, dropped {} queued games", playerId, sessionId, dropped);
            }
        }
        return saveAndPublish(session.withPlayers(players).withGames(games));
    }

    /**
     * Takes a player out of the session together with their queued games. Players who
     * have a game playing or completed stay on the session's record.
     */
    public synchronized Session removePlayer(String sessionId, String playerId) {
        Session session = requireInProgress(sessionId);
        if (session.player(playerId).isEmpty()) {
            throw new SessionNotFoundException("Player " + playerId + " is not in session " + sessionId);
        }
        boolean hasPlayed = session.games().stream()
            .anyMatch(g -> g.status() != MatchStatus.QUEUED && g.match().involves(playerId));
        if (hasPlayed) {
            throw new SessionStateException("Player " + playerId
                + " has games in progress or completed; mark them as left instead");
        }
        List<SessionPlayer> players = session.players().stream()
            .filter(p -> !p.playerId().equals(playerId))
            .toList();
        List<SessionGame> games = session.games().stream()
            .filter(g -> !g.match().involves(playerId))
            .toList();
        logger.info("Removed player {} from session {}", playerId, sessionId);
        return saveAndPublish(session.withPlayers(players).withGames(games));
    }

    /**
     * Generates the next few games for the session's active players and appends them to the
     * queue, numbered after every existing game. Returns an empty result flagged
     * {@link GeneratedQueue.Termination#INSUFFICIENT_PARTICIPANTS} when fewer than four
     * players are active.
     */
    public synchronized QueueGenerationResult generateQueue(String sessionId) {
        Session session = requireInProgress(sessionId);
        List<String> activeIds = session.activePlayerIds();
        if (activeIds.size() > maxActiveParticipants) {
            throw new SessionStateException("Too many active players for queue generation: "
                + activeIds.size() + " (limit " + maxActiveParticipants + ")");
        }

        List<Participant> participants = activeIds.stream()
            .map(ledger::requireAccount)
            .map(this::toParticipant)
            .toList();
        GeneratedQueue queue = queueBuilder.buildQueue(participants, session.matchHistory());
        if (queue.isEmpty()) {
            logger.info("No games generated for session {}: {}", sessionId, queue.termination());
            return new QueueGenerationResult(List.of(), queue.termination());
        }

        int nextNumber = session.nextGameNumber();
        List<SessionGame> added = new ArrayList<>();
        for (Candidate candidate : queue.matches()) {
            added.add(new SessionGame(nextNumber++, candidate.toMatchRecord(), false));
        }
        List<SessionGame> games = new ArrayList<>(session.games());
        games.addAll(added);
        saveAndPublish(session.withGames(games));
        logger.info("Generated {} games for session {} ({})", added.size(), sessionId, queue.termination());
        return new QueueGenerationResult(ImmutableList.copyOf(added), queue.termination());
    }

    /**
     * Queues a hand-picked game. All four players must be active in the session.
     */
    public synchronized SessionGame addCustomGame(String sessionId, List<String> teamA, List<String> teamB) {
        Session session = requireInProgress(sessionId);
        MatchRecord match = new MatchRecord(teamA, teamB, MatchStatus.QUEUED);
        requireActive(session, match);
        SessionGame game = new SessionGame(session.nextGameNumber(), match, true);
        List<SessionGame> games = new ArrayList<>(session.games());
        games.add(game);
        saveAndPublish(session.withGames(games));
        return game;
    }

    /**
     * Replaces the teams of a queued game. All four players must be active in the session.
     */
    public synchronized SessionGame editGame(String sessionId, int gameNumber,
                                             List<String> teamA, List<String> teamB) {
        Session session = requireInProgress(sessionId);
        SessionGame game = requireGame(session, gameNumber);
        if (game.status() != MatchStatus.QUEUED) {
            throw new SessionStateException("Game " + gameNumber + " is " + game.status()
                + ", only queued games can be edited");
        }
        MatchRecord match = new MatchRecord(teamA, teamB, MatchStatus.QUEUED);
        requireActive(session, match);
        SessionGame updated = new SessionGame(gameNumber, match, game.custom());
        List<SessionGame> games = session.games().stream()
            .map(g -> g.gameNumber() == gameNumber ? updated : g)
            .toList();
        saveAndPublish(session.withGames(games));
        return updated;
    }

    public synchronized SessionGame startGame(String sessionId, int gameNumber) {
        return transition(sessionId, gameNumber, MatchStatus.QUEUED, MatchStatus.PLAYING);
    }

    public synchronized SessionGame completeGame(String sessionId, int gameNumber) {
        return transition(sessionId, gameNumber, MatchStatus.PLAYING, MatchStatus.COMPLETED);
    }

    /**
     * Removes a queued or in-progress game. Completed games are part of the session's
     * record and cannot be removed.
     */
    public synchronized Session removeGame(String sessionId, int gameNumber) {
        Session session = requireInProgress(sessionId);
        SessionGame game = requireGame(session, gameNumber);
        if (game.status() == MatchStatus.COMPLETED) {
            throw new SessionStateException("Game " + gameNumber + " is completed and cannot be removed");
        }
        List<SessionGame> games = session.games().stream()
            .filter(g -> g.gameNumber() != gameNumber)
            .toList();
        return saveAndPublish(session.withGames(games));
    }

    /**
     * Saves cost settings on a session still in progress. {@link #completeSession} falls
     * back to them when no costs are given.
     */
    public synchronized Session saveSessionCosts(String sessionId, SessionCosts costs) {
        Session session = requireInProgress(sessionId);
        return saveAndPublish(session.withCosts(costs));
    }

    /**
     * Ends the session and charges every player for the games they completed. The session
     * is saved as completed before the ledger changes, so a failed save leaves balances
     * untouched and the session open for another attempt.
     *
     * @param costs final costs, or {@code null} to use the session's saved settings
     * @throws SessionStateException if no game has been completed or no costs are known
     */
    public synchronized SessionBreakdown completeSession(String sessionId, SessionCosts costs) {
        Session session = requireInProgress(sessionId);
        List<MatchRecord> completed = session.completedMatches();
        if (completed.isEmpty()) {
            throw new SessionStateException("No completed games in session " + sessionId);
        }
        SessionCosts finalCosts = costs != null ? costs : session.costs();
        if (finalCosts == null) {
            throw new SessionStateException("No costs given or saved for session " + sessionId);
        }
        SessionBreakdown breakdown = CostCalculator.breakdown(finalCosts, completed);
        breakdown.playerCharges().keySet().forEach(ledger::requireAccount);

        Session completedSession = session.completed(finalCosts);
        save(completedSession);
        ledger.applyCharges(sessionId, session.date(), breakdown);
        saveLedger();
        publisher.publish(completedSession);
        logger.info("Completed session {}: {} games, total cost {}", sessionId,
            breakdown.totalGames(), breakdown.totalCost());
        return breakdown;
    }

    /**
     * Re-prices a completed session and applies the per-player differences.
     */
    public synchronized CostAdjustment updateSessionCosts(String sessionId, SessionCosts newCosts) {
        Session session = getSession(sessionId);
        if (session.status() != SessionStatus.COMPLETED) {
            throw new SessionStateException("Session " + sessionId + " is not completed");
        }
        CostAdjustment adjustment = CostCalculator.costDifference(
            session.costs() == null ? SessionCosts.NONE : session.costs(), newCosts, session.completedMatches());
        adjustment.differences().keySet().forEach(ledger::requireAccount);
        Session updated = session.completed(newCosts);
        save(updated);
        ledger.adjustCharges(sessionId, session.date(), adjustment);
        saveLedger();
        publisher.publish(updated);
        return adjustment;
    }

    /**
     * Discards a session that has no completed games.
     */
    public synchronized void cancelSession(String sessionId) {
        Session session = requireInProgress(sessionId);
        if (!session.completedMatches().isEmpty()) {
            throw new SessionStateException(
                "Cannot cancel session with completed games. Complete the session instead.");
        }
        deleteFile(sessionId);
        logger.info("Cancelled session {}", sessionId);
    }

    public synchronized DeletionImpact deletionImpact(String sessionId) {
        return impactOf(getSession(sessionId));
    }

    /**
     * Deletes a session and undoes its effect on the ledger: charges are reversed, games
     * are subtracted from lifetime counts and the session's transactions are removed.
     */
    public synchronized DeletionImpact deleteSession(String sessionId) {
        Session session = getSession(sessionId);
        DeletionImpact impact = impactOf(session);
        if (session.status() == SessionStatus.COMPLETED) {
            ledger.reverseCharges(sessionId);
            ledger.subtractGames(impact.playerGames());
        }
        ledger.removeTransactions(sessionId);
        saveLedger();
        deleteFile(sessionId);
        logger.info("Deleted session {} ({} players affected)", sessionId, impact.playersAffected());
        return impact;
    }

    private DeletionImpact impactOf(Session session) {
        List<MatchRecord> completed = session.completedMatches();
        Map<String, Integer> playerGames = CostCalculator.playerGameCounts(completed);
        BigDecimal totalCharges = session.status() == SessionStatus.COMPLETED && session.costs() != null
            ? CostCalculator.totalCost(session.costs())
            : BigDecimal.ZERO;
        return new DeletionImpact(session.date(), session.status(), playerGames.size(),
            session.games().size(), completed.size(), totalCharges, playerGames);
    }

    private SessionGame transition(String sessionId, int gameNumber, MatchStatus from, MatchStatus to) {
        Session session = requireInProgress(sessionId);
        SessionGame game = requireGame(session, gameNumber);
        if (game.status() != from) {
            throw new SessionStateException("Game " + gameNumber + " is " + game.status()
                + ", expected " + from);
        }
        SessionGame updated = game.withStatus(to);
        List<SessionGame> games = session.games().stream()
            .map(g -> g.gameNumber() == gameNumber ? updated : g)
            .toList();
        saveAndPublish(session.withGames(games));
        return updated;
    }

    private static void requireActive(Session session, MatchRecord match) {
        List<String> active = session.activePlayerIds();
        for (String playerId : match.playerIds()) {
            if (!active.contains(playerId)) {
                throw new SessionStateException("Player " + playerId + " is not active in session " + session.id());
            }
        }
    }

    private Participant toParticipant(PlayerAccount account) {
        return new Participant(account.id(), account.name(), account.totalGamesPlayed());
    }

    private Session requireInProgress(String sessionId) {
        Session session = getSession(sessionId);
        if (session.status() != SessionStatus.IN_PROGRESS) {
            throw new SessionStateException("Session " + sessionId + " is " + session.status());
        }
        return session;
    }

    private static SessionGame requireGame(Session session, int gameNumber) {
        return session.game(gameNumber)
            .orElseThrow(() -> new SessionNotFoundException(
                "Game " + gameNumber + " not found in session " + session.id()));
    }

    private Session saveAndPublish(Session session) {
        save(session);
        publisher.publish(session);
        return session;
    }

    private void save(Session session) {
        try {
            store.save(session);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save session " + session.id(), e);
        }
    }

    private void saveLedger() {
        try {
            store.saveLedger(ledger.snapshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save ledger", e);
        }
    }

    private void deleteFile(String sessionId) {
        try {
            store.delete(sessionId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete session " + sessionId, e);
        }
    }
}
