package org.courtside.rotation.web;

import org.courtside.rotation.ledger.Ledger;
import org.courtside.rotation.ledger.SessionBreakdown;
import org.courtside.rotation.scheduler.MatchStatus;
import org.courtside.rotation.scheduler.QueueBuilder;
import org.courtside.rotation.session.DeletionImpact;
import org.courtside.rotation.session.Session;
import org.courtside.rotation.session.SessionGame;
import org.courtside.rotation.session.SessionNotFoundException;
import org.courtside.rotation.session.SessionService;
import org.courtside.rotation.session.SessionStateException;
import org.courtside.rotation.session.SessionStore;
import org.courtside.rotation.session.SessionUpdatePublisher;
import org.courtside.rotation.web.dto.AddPlayerRequest;
import org.courtside.rotation.web.dto.CreateSessionRequest;
import org.courtside.rotation.web.dto.CustomGameRequest;
import org.courtside.rotation.web.dto.SessionCostsRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for SessionController backed by a real SessionService.
 */
class SessionControllerTest {

    @TempDir
    Path tempDir;

    private SessionController controller;
    private SessionProgressController progressController;

    @BeforeEach
    void setUp() {
        Ledger ledger = new Ledger();
        for (String id : List.of("amy", "ben", "cal", "dee", "eve")) {
            ledger.register(id, id);
        }
        SessionService service = new SessionService(new SessionStore(tempDir), ledger, new QueueBuilder(),
            new SessionUpdatePublisher(mock(SimpMessagingTemplate.class)), 40);
        controller = new SessionController(service);
        progressController = new SessionProgressController(service);
    }

    @Test
    void createSession_returnsCreated() {
        ResponseEntity<Session> response = controller.createSession(new CreateSessionRequest(LocalDate.of(2026, 6, 1)));

        assertEquals(201, response.getStatusCode().value());
        assertNotNull(response.getBody());
        assertEquals(1, controller.listSessions().size());
    }

    @Test
    void generateQueue_notEnoughPlayersIsReportedInBody() {
        String id = sessionWith("amy", "ben");

        ResponseEntity<Map<String, Object>> response = controller.generateQueue(id);

        assertEquals(200, response.getStatusCode().value());
        assertEquals("Need at least 4 active players to generate queue", response.getBody().get("message"));
        assertEquals(List.of(), response.getBody().get("games"));
    }

    @Test
    void generateQueue_returnsNewGames() {
        String id = sessionWith("amy", "ben", "cal", "dee", "eve");

        ResponseEntity<Map<String, Object>> response = controller.generateQueue(id);

        assertEquals("Generated 3 games", response.getBody().get("message"));
        assertEquals(3, controller.getSession(id).games().size());
    }

    @Test
    void fullSessionFlow_chargesPlayers() {
        String id = sessionWith("amy", "ben", "cal", "dee");
        ResponseEntity<SessionGame> custom = controller.addCustomGame(id,
            new CustomGameRequest(List.of("amy", "ben"), List.of("cal", "dee")));
        assertEquals(201, custom.getStatusCode().value());

        controller.startGame(id, 1);
        assertEquals(MatchStatus.COMPLETED, controller.completeGame(id, 1).status());
        SessionBreakdown breakdown = controller.completeSession(id,
            new SessionCostsRequest(new BigDecimal("32.00"), new BigDecimal("24.00"), 12));

        assertEquals(0, new BigDecimal("56.00").compareTo(breakdown.totalCost()));
        assertEquals(0, new BigDecimal("14.00").compareTo(breakdown.playerCharges().get("amy").amountOwed()));
    }

    @Test
    void removeGame_dropsQueuedGame() {
        String id = sessionWith("amy", "ben", "cal", "dee");
        controller.addCustomGame(id, new CustomGameRequest(List.of("amy", "ben"), List.of("cal", "dee")));

        Session updated = controller.removeGame(id, 1);

        assertTrue(updated.games().isEmpty());
    }

    @Test
    void removePlayer_takesPlayerOutOfSession() {
        String id = sessionWith("amy", "ben");

        Session updated = controller.removePlayer(id, "ben");

        assertEquals(List.of("amy"), updated.activePlayerIds());
        assertTrue(updated.player("ben").isEmpty());
    }

    @Test
    void editGame_swapsTeams() {
        String id = sessionWith("amy", "ben", "cal", "dee");
        controller.addCustomGame(id, new CustomGameRequest(List.of("amy", "ben"), List.of("cal", "dee")));

        SessionGame edited = controller.editGame(id, 1,
            new CustomGameRequest(List.of("amy", "cal"), List.of("ben", "dee")));

        assertEquals(List.of("amy", "cal"), edited.match().teamA());
        assertEquals(List.of("ben", "dee"), controller.getSession(id).game(1).orElseThrow().match().teamB());
    }

    @Test
    void completeSession_withoutBodyUsesSavedSettings() {
        String id = sessionWith("amy", "ben", "cal", "dee");
        controller.addCustomGame(id, new CustomGameRequest(List.of("amy", "ben"), List.of("cal", "dee")));
        controller.startGame(id, 1);
        controller.completeGame(id, 1);

        controller.saveSettings(id, new SessionCostsRequest(new BigDecimal("32.00"), new BigDecimal("24.00"), 12));
        SessionBreakdown breakdown = controller.completeSession(id, null);

        assertEquals(0, new BigDecimal("56.00").compareTo(breakdown.totalCost()));
    }

    @Test
    void togglePlayer_marksPlayerLeft() {
        String id = sessionWith("amy");

        Session updated = controller.togglePlayer(id, "amy");

        assertTrue(updated.activePlayerIds().isEmpty());
    }

    @Test
    void cancelSession_returnsNoContent() {
        String id = sessionWith("amy");

        assertEquals(204, controller.cancelSession(id).getStatusCode().value());
        assertThrows(SessionNotFoundException.class, () -> controller.getSession(id));
    }

    @Test
    void updateCosts_inProgressSessionConflicts() {
        String id = sessionWith("amy");

        assertThrows(SessionStateException.class, () -> controller.updateCosts(id,
            new SessionCostsRequest(BigDecimal.TEN, BigDecimal.ZERO, 0)));
    }

    @Test
    void deleteSession_reportsImpact() {
        String id = sessionWith("amy", "ben");

        DeletionImpact preview = controller.deletionImpact(id);
        DeletionImpact impact = controller.deleteSession(id);

        assertEquals(preview, impact);
        assertEquals(0, impact.completedGames());
        assertThrows(SessionNotFoundException.class, () -> controller.getSession(id));
    }

    @Test
    void subscribeSession_returnsCurrentStateOrNull() {
        String id = sessionWith("amy");

        assertEquals(id, progressController.subscribeSession(id).id());
        assertNull(progressController.subscribeSession("missing"));
    }

    private String sessionWith(String... playerIds) {
        Session session = controller.createSession(new CreateSessionRequest(LocalDate.of(2026, 6, 1))).getBody();
        for (String playerId : playerIds) {
            controller.addPlayer(session.id(), new AddPlayerRequest(playerId));
        }
        return session.id();
    }
}
