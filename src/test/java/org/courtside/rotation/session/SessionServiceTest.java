package org.courtside.rotation.session;

import org.courtside.rotation.ledger.CostAdjustment;
import org.courtside.rotation.ledger.Ledger;
import org.courtside.rotation.ledger.LedgerSnapshot;
import org.courtside.rotation.ledger.PlayerNotFoundException;
import org.courtside.rotation.ledger.SessionBreakdown;
import org.courtside.rotation.ledger.SessionCosts;
import org.courtside.rotation.scheduler.MatchStatus;
import org.courtside.rotation.scheduler.QueueBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionServiceTest {

    private static final LocalDate DATE = LocalDate.of(2026, 4, 11);

    @TempDir
    Path tempDir;

    private SessionStore store;
    private Ledger ledger;
    private SimpMessagingTemplate messagingTemplate;
    private SessionService service;

    @BeforeEach
    void setUp() {
        store = new SessionStore(tempDir);
        ledger = new Ledger();
        for (String id : List.of("a", "b", "c", "d", "e", "f")) {
            ledger.register(id, id.toUpperCase());
        }
        messagingTemplate = mock(SimpMessagingTemplate.class);
        service = new SessionService(store, ledger, new QueueBuilder(),
            new SessionUpdatePublisher(messagingTemplate), 40);
    }

    @Test
    void createSession_isStoredInProgress() {
        Session session = service.createSession(DATE);

        assertEquals(SessionStatus.IN_PROGRESS, session.status());
        assertEquals(session, service.getSession(session.id()));
        assertEquals(1, service.listSessions().size());
    }

    @Test
    void getSession_unknownIdThrows() {
        assertThrows(SessionNotFoundException.class, () -> service.getSession("missing"));
    }

    @Test
    void addPlayer_requiresRegisteredPlayer() {
        Session session = service.createSession(DATE);

        assertThrows(PlayerNotFoundException.class, () -> service.addPlayer(session.id(), "ghost"));
    }

    @Test
    void addPlayer_rejectsPlayerAlreadyInSession() {
        String id = sessionWith("a");

        assertThrows(SessionStateException.class, () -> service.addPlayer(id, "a"));
    }

    @Test
    void addPlayer_publishesUpdate() {
        String id = sessionWith("a");

        verify(messagingTemplate, atLeastOnce()).convertAndSend(eq(SessionUpdatePublisher.topic(id)), any(Session.class));
    }

    @Test
    void addPlayer_survivesBrokerFailure() {
        doThrow(new IllegalStateException("broker down"))
            .when(messagingTemplate).convertAndSend(any(String.class), any(Object.class));
        Session session = service.createSession(DATE);

        Session updated = service.addPlayer(session.id(), "a");

        assertEquals(1, updated.players().size());
    }

    @Test
    void generateQueue_reportsNotEnoughPlayers() {
        String id = sessionWith("a", "b", "c");

        QueueGenerationResult result = service.generateQueue(id);

        assertTrue(result.notEnoughPlayers());
        assertTrue(result.games().isEmpty());
        assertTrue(service.getSession(id).games().isEmpty());
    }

    @Test
    void generateQueue_numbersGamesAfterExistingOnes() {
        String id = sessionWith("a", "b", "c", "d", "e");

        QueueGenerationResult first = service.generateQueue(id);
        QueueGenerationResult second = service.generateQueue(id);

        assertEquals(List.of(1, 2, 3), first.games().stream().map(SessionGame::gameNumber).toList());
        assertEquals(4, second.games().get(0).gameNumber());
        assertEquals(first.games().size() + second.games().size(), service.getSession(id).games().size());
        assertTrue(first.games().stream().allMatch(g -> g.status() == MatchStatus.QUEUED && !g.custom()));
    }

    @Test
    void generateQueue_usesOnlyActivePlayers() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.togglePlayerStatus(id, "e");

        QueueGenerationResult result = service.generateQueue(id);

        assertEquals(1, result.games().size());
        assertFalse(result.games().get(0).match().involves("e"));
    }

    @Test
    void generateQueue_rejectsOversizedPool() {
        SessionService small = new SessionService(store, ledger, new QueueBuilder(),
            new SessionUpdatePublisher(messagingTemplate), 4);
        Session session = small.createSession(DATE);
        for (String player : List.of("a", "b", "c", "d", "e")) {
            small.addPlayer(session.id(), player);
        }

        assertThrows(SessionStateException.class, () -> small.generateQueue(session.id()));
    }

    @Test
    void togglePlayerStatus_leavingDropsQueuedGames() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.generateQueue(id);
        service.startGame(id, 1);

        Session updated = service.togglePlayerStatus(id, "e");

        assertEquals(PlayerStatus.LEFT, updated.player("e").orElseThrow().status());
        for (SessionGame game : updated.games()) {
            if (game.status() == MatchStatus.QUEUED) {
                assertFalse(game.match().involves("e"), "Queued game still has e: " + game);
            }
        }
        assertEquals(MatchStatus.PLAYING, updated.game(1).orElseThrow().status());
    }

    @Test
    void togglePlayerStatus_twiceReactivates() {
        String id = sessionWith("a");

        service.togglePlayerStatus(id, "a");
        Session updated = service.togglePlayerStatus(id, "a");

        assertEquals(List.of("a"), updated.activePlayerIds());
    }

    @Test
    void removePlayer_dropsPlayerAndQueuedGames() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        service.addCustomGame(id, List.of("a", "e"), List.of("c", "d"));

        Session updated = service.removePlayer(id, "e");

        assertTrue(updated.player("e").isEmpty());
        assertEquals(List.of(1), updated.games().stream().map(SessionGame::gameNumber).toList());
        assertEquals(updated, service.getSession(id));
    }

    @Test
    void removePlayer_refusedOncePlayerHasPlayed() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        service.startGame(id, 1);

        assertThrows(SessionStateException.class, () -> service.removePlayer(id, "a"));
        service.completeGame(id, 1);
        assertThrows(SessionStateException.class, () -> service.removePlayer(id, "a"));
        assertTrue(service.getSession(id).player("a").isPresent());
    }

    @Test
    void removePlayer_unknownPlayerThrows() {
        String id = sessionWith("a");

        assertThrows(SessionNotFoundException.class, () -> service.removePlayer(id, "b"));
    }

    @Test
    void editGame_replacesTeamsOfQueuedGame() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));

        SessionGame edited = service.editGame(id, 1, List.of("a", "e"), List.of("c", "d"));

        assertEquals(1, edited.gameNumber());
        assertTrue(edited.custom());
        assertEquals(MatchStatus.QUEUED, edited.status());
        assertEquals(List.of("a", "e"), edited.match().teamA());
        assertEquals(edited, service.getSession(id).game(1).orElseThrow());
    }

    @Test
    void editGame_validatesTeamsAndStatus() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        int queued = service.addCustomGame(id, List.of("a", "b"), List.of("c", "d")).gameNumber();
        service.togglePlayerStatus(id, "e");
        service.startGame(id, 1);

        assertThrows(SessionStateException.class,
            () -> service.editGame(id, 1, List.of("a", "c"), List.of("b", "d")));
        assertThrows(SessionStateException.class,
            () -> service.editGame(id, queued, List.of("a", "b"), List.of("c", "e")));
        assertThrows(IllegalArgumentException.class,
            () -> service.editGame(id, queued, List.of("a", "b"), List.of("c", "a")));
        assertThrows(SessionNotFoundException.class,
            () -> service.editGame(id, 9, List.of("a", "b"), List.of("c", "d")));
    }

    @Test
    void addCustomGame_requiresActivePlayers() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.togglePlayerStatus(id, "e");

        assertThrows(SessionStateException.class,
            () -> service.addCustomGame(id, List.of("a", "b"), List.of("c", "e")));
        assertThrows(IllegalArgumentException.class,
            () -> service.addCustomGame(id, List.of("a", "b"), List.of("c", "a")));
    }

    @Test
    void addCustomGame_isNumberedAndFlagged() {
        String id = sessionWith("a", "b", "c", "d");

        SessionGame game = service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));

        assertEquals(1, game.gameNumber());
        assertTrue(game.custom());
        assertEquals(MatchStatus.QUEUED, game.status());
    }

    @Test
    void gameLifecycle_movesQueuedToPlayingToCompleted() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));

        assertThrows(SessionStateException.class, () -> service.completeGame(id, 1));
        assertEquals(MatchStatus.PLAYING, service.startGame(id, 1).status());
        assertThrows(SessionStateException.class, () -> service.startGame(id, 1));
        assertEquals(MatchStatus.COMPLETED, service.completeGame(id, 1).status());
        assertThrows(SessionNotFoundException.class, () -> service.startGame(id, 9));
    }

    @Test
    void removeGame_refusesCompletedGames() {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        service.addCustomGame(id, List.of("a", "e"), List.of("c", "d"));
        playThrough(id, 1);

        assertThrows(SessionStateException.class, () -> service.removeGame(id, 1));
        Session updated = service.removeGame(id, 2);
        assertEquals(1, updated.games().size());
    }

    @Test
    void completeSession_requiresACompletedGame() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));

        assertThrows(SessionStateException.class, () -> service.completeSession(id, costs("20.00")));
    }

    @Test
    void completeSession_chargesPlayersForCompletedGames() throws Exception {
        String id = sessionWith("a", "b", "c", "d", "e");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        service.addCustomGame(id, List.of("a", "e"), List.of("c", "d"));
        playThrough(id, 1);

        SessionBreakdown breakdown = service.completeSession(id, costs("20.00"));

        assertEquals(1, breakdown.totalGames());
        assertMoney("-5.00", ledger.requireAccount("a").balance());
        assertMoney("0.00", ledger.requireAccount("e").balance());
        assertEquals(1, ledger.requireAccount("a").totalGamesPlayed());
        assertEquals(SessionStatus.COMPLETED, service.getSession(id).status());

        LedgerSnapshot persisted = store.loadLedger();
        assertEquals(4, persisted.transactions().size());
    }

    @Test
    void saveSessionCosts_areUsedWhenCompletingWithoutCosts() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);

        Session saved = service.saveSessionCosts(id, costs("12.00"));
        assertEquals(SessionStatus.IN_PROGRESS, saved.status());
        assertMoney("12.00", service.getSession(id).costs().courtFee());

        SessionBreakdown breakdown = service.completeSession(id, null);

        assertMoney("12.00", breakdown.totalCost());
        assertMoney("-3.00", ledger.requireAccount("a").balance());
        assertMoney("12.00", service.getSession(id).costs().courtFee());
    }

    @Test
    void completeSession_givenCostsOverrideSavedOnes() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);
        service.saveSessionCosts(id, costs("12.00"));

        service.completeSession(id, costs("20.00"));

        assertMoney("-5.00", ledger.requireAccount("a").balance());
        assertMoney("20.00", service.getSession(id).costs().courtFee());
    }

    @Test
    void completeSession_withoutAnyCostsIsRefused() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);

        assertThrows(SessionStateException.class, () -> service.completeSession(id, null));
        assertEquals(SessionStatus.IN_PROGRESS, service.getSession(id).status());
    }

    @Test
    void saveSessionCosts_refusedOnCompletedSession() {
        String id = completedSession("20.00");

        assertThrows(SessionStateException.class, () -> service.saveSessionCosts(id, costs("10.00")));
    }

    @Test
    void completeSession_failedSaveLeavesLedgerUntouchedAndRetryChargesOnce() throws Exception {
        AtomicBoolean failCompletedSaves = new AtomicBoolean(true);
        SessionStore flakyStore = new SessionStore(tempDir) {
            @Override
            public void save(Session session) throws IOException {
                if (session.status() == SessionStatus.COMPLETED && failCompletedSaves.get()) {
                    throw new IOException("disk full");
                }
                super.save(session);
            }
        };
        service = new SessionService(flakyStore, ledger, new QueueBuilder(),
            new SessionUpdatePublisher(messagingTemplate), 40);
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);

        assertThrows(UncheckedIOException.class, () -> service.completeSession(id, costs("20.00")));

        assertMoney("0.00", ledger.requireAccount("a").balance());
        assertTrue(ledger.transactions().isEmpty());
        assertTrue(flakyStore.loadLedger().transactions().isEmpty());
        assertEquals(SessionStatus.IN_PROGRESS, service.getSession(id).status());

        failCompletedSaves.set(false);
        service.completeSession(id, costs("20.00"));

        assertMoney("-5.00", ledger.requireAccount("a").balance());
        assertEquals(4, flakyStore.loadLedger().transactions().size());
        assertEquals(SessionStatus.COMPLETED, service.getSession(id).status());
    }

    @Test
    void completeSession_cannotRunTwice() {
        String id = completedSession("20.00");

        assertThrows(SessionStateException.class, () -> service.completeSession(id, costs("20.00")));
        assertThrows(SessionStateException.class, () -> service.addPlayer(id, "e"));
    }

    @Test
    void updateSessionCosts_appliesDifference() {
        String id = completedSession("20.00");

        CostAdjustment adjustment = service.updateSessionCosts(id, costs("28.00"));

        assertMoney("2.00", adjustment.differences().get("a").difference());
        assertMoney("-7.00", ledger.requireAccount("a").balance());
        assertMoney("28.00", service.getSession(id).costs().courtFee());
    }

    @Test
    void updateSessionCosts_requiresCompletedSession() {
        String id = sessionWith("a");

        assertThrows(SessionStateException.class, () -> service.updateSessionCosts(id, costs("10.00")));
    }

    @Test
    void cancelSession_refusedOnceGamesCompleted() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);

        assertThrows(SessionStateException.class, () -> service.cancelSession(id));
    }

    @Test
    void cancelSession_deletesSession() {
        String id = sessionWith("a", "b", "c", "d");
        service.generateQueue(id);

        service.cancelSession(id);

        assertThrows(SessionNotFoundException.class, () -> service.getSession(id));
    }

    @Test
    void deletionImpact_inProgressSessionHasNoCharges() {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);

        DeletionImpact impact = service.deletionImpact(id);

        assertEquals(0, impact.totalCharges().signum());
        assertEquals(1, impact.completedGames());
        assertEquals(4, impact.playersAffected());
    }

    @Test
    void deleteSession_undoesCompletedSession() {
        ledger.recordPayment("a", new BigDecimal("10.00"), "Cash");
        String id = completedSession("20.00");
        assertMoney("5.00", ledger.requireAccount("a").balance());

        DeletionImpact impact = service.deleteSession(id);

        assertMoney("20.00", impact.totalCharges());
        assertEquals(SessionStatus.COMPLETED, impact.status());
        assertMoney("10.00", ledger.requireAccount("a").balance());
        assertMoney("0.00", ledger.requireAccount("b").balance());
        assertEquals(0, ledger.requireAccount("a").totalGamesPlayed());
        assertTrue(ledger.transactionsFor(id).isEmpty());
        assertEquals(1, ledger.transactions().size());
        assertThrows(SessionNotFoundException.class, () -> service.getSession(id));
    }

    private String sessionWith(String... playerIds) {
        Session session = service.createSession(DATE);
        for (String playerId : playerIds) {
            service.addPlayer(session.id(), playerId);
        }
        return session.id();
    }

    private String completedSession(String courtFee) {
        String id = sessionWith("a", "b", "c", "d");
        service.addCustomGame(id, List.of("a", "b"), List.of("c", "d"));
        playThrough(id, 1);
        service.completeSession(id, costs(courtFee));
        return id;
    }

    private void playThrough(String sessionId, int gameNumber) {
        service.startGame(sessionId, gameNumber);
        service.completeGame(sessionId, gameNumber);
    }

    private static SessionCosts costs(String courtFee) {
        return new SessionCosts(new BigDecimal(courtFee), BigDecimal.ZERO, 0);
    }

    private static void assertMoney(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }
}
