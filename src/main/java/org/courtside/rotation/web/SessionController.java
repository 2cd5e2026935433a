package org.courtside.rotation.web;

import jakarta.validation.Valid;
import org.courtside.rotation.ledger.CostAdjustment;
import org.courtside.rotation.ledger.SessionBreakdown;
import org.courtside.rotation.session.DeletionImpact;
import org.courtside.rotation.session.QueueGenerationResult;
import org.courtside.rotation.session.Session;
import org.courtside.rotation.session.SessionGame;
import org.courtside.rotation.session.SessionService;
import org.courtside.rotation.web.dto.AddPlayerRequest;
import org.courtside.rotation.web.dto.CreateSessionRequest;
import org.courtside.rotation.web.dto.CustomGameRequest;
import org.courtside.rotation.web.dto.SessionCostsRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for sessions, their players and the game queue.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public List<Session> listSessions() {
        return sessionService.listSessions();
    }

    @PostMapping
    public ResponseEntity<Session> createSession(@Valid @RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.createSession(request.date()));
    }

    @GetMapping("/{sessionId}")
    public Session getSession(@PathVariable String sessionId) {
        return sessionService.getSession(sessionId);
    }

    @PostMapping("/{sessionId}/players")
    public Session addPlayer(@PathVariable String sessionId, @Valid @RequestBody AddPlayerRequest request) {
        return sessionService.addPlayer(sessionId, request.playerId());
    }

    @PostMapping("/{sessionId}/players/{playerId}/toggle")
    public Session togglePlayer(@PathVariable String sessionId, @PathVariable String playerId) {
        return sessionService.togglePlayerStatus(sessionId, playerId);
    }

    @DeleteMapping("/{sessionId}/players/{playerId}")
    public Session removePlayer(@PathVariable String sessionId, @PathVariable String playerId) {
        return sessionService.removePlayer(sessionId, playerId);
    }

    /**
     * Generates the next games. Fewer than four active players is reported in the body
     * rather than as an error, since it is an expected situation at the start of a night.
     */
    @PostMapping("/{sessionId}/queue")
    public ResponseEntity<Map<String, Object>> generateQueue(@PathVariable String sessionId) {
        QueueGenerationResult result = sessionService.generateQueue(sessionId);
        String message = result.notEnoughPlayers()
            ? "Need at least 4 active players to generate queue"
            : "Generated " + result.games().size() + " games";
        return ResponseEntity.ok(Map.of(
            "games", result.games(),
            "termination", result.termination(),
            "message", message));
    }

    @PostMapping("/{sessionId}/games")
    public ResponseEntity<SessionGame> addCustomGame(@PathVariable String sessionId,
                                                     @Valid @RequestBody CustomGameRequest request) {
        SessionGame game = sessionService.addCustomGame(sessionId, request.teamA(), request.teamB());
        return ResponseEntity.status(HttpStatus.CREATED).body(game);
    }

    @PutMapping("/{sessionId}/games/{gameNumber}")
    public SessionGame editGame(@PathVariable String sessionId, @PathVariable int gameNumber,
                                @Valid @RequestBody CustomGameRequest request) {
        return sessionService.editGame(sessionId, gameNumber, request.teamA(), request.teamB());
    }

    @PostMapping("/{sessionId}/games/{gameNumber}/start")
    public SessionGame startGame(@PathVariable String sessionId, @PathVariable int gameNumber) {
        return sessionService.startGame(sessionId, gameNumber);
    }

    @PostMapping("/{sessionId}/games/{gameNumber}/complete")
    public SessionGame completeGame(@PathVariable String sessionId, @PathVariable int gameNumber) {
        return sessionService.completeGame(sessionId, gameNumber);
    }

    @DeleteMapping("/{sessionId}/games/{gameNumber}")
    public Session removeGame(@PathVariable String sessionId, @PathVariable int gameNumber) {
        return sessionService.removeGame(sessionId, gameNumber);
    }

    @PutMapping("/{sessionId}/settings")
    public Session saveSettings(@PathVariable String sessionId,
                                @Valid @RequestBody SessionCostsRequest request) {
        return sessionService.saveSessionCosts(sessionId, request.toCosts());
    }

    /**
     * Completes the session. Without a body the costs saved through {@code /settings} apply.
     */
    @PostMapping("/{sessionId}/complete")
    public SessionBreakdown completeSession(@PathVariable String sessionId,
                                            @Valid @RequestBody(required = false) SessionCostsRequest request) {
        return sessionService.completeSession(sessionId, request == null ? null : request.toCosts());
    }

    @PutMapping("/{sessionId}/costs")
    public CostAdjustment updateCosts(@PathVariable String sessionId,
                                      @Valid @RequestBody SessionCostsRequest request) {
        return sessionService.updateSessionCosts(sessionId, request.toCosts());
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<Void> cancelSession(@PathVariable String sessionId) {
        sessionService.cancelSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{sessionId}/deletion-impact")
    public DeletionImpact deletionImpact(@PathVariable String sessionId) {
        return sessionService.deletionImpact(sessionId);
    }

    @DeleteMapping("/{sessionId}")
    public DeletionImpact deleteSession(@PathVariable String sessionId) {
        return sessionService.deleteSession(sessionId);
    }
}
