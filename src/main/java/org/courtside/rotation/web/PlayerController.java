package org.courtside.rotation.web;

import jakarta.validation.Valid;
import org.courtside.rotation.ledger.LedgerTransaction;
import org.courtside.rotation.ledger.PlayerAccount;
import org.courtside.rotation.session.PlayerService;
import org.courtside.rotation.web.dto.PaymentRequest;
import org.courtside.rotation.web.dto.RegisterPlayerRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the player registry and balances.
 */
@RestController
@RequestMapping("/api/players")
public class PlayerController {

    private final PlayerService playerService;

    public PlayerController(PlayerService playerService) {
        this.playerService = playerService;
    }

    @GetMapping
    public List<PlayerAccount> listPlayers() {
        return playerService.listPlayers();
    }

    @PostMapping
    public ResponseEntity<PlayerAccount> registerPlayer(@Valid @RequestBody RegisterPlayerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(playerService.register(request.name()));
    }

    @GetMapping("/{playerId}")
    public PlayerAccount getPlayer(@PathVariable String playerId) {
        return playerService.getPlayer(playerId);
    }

    @GetMapping("/{playerId}/transactions")
    public List<LedgerTransaction> getTransactions(@PathVariable String playerId) {
        return playerService.transactionsFor(playerId);
    }

    @PostMapping("/{playerId}/payments")
    public ResponseEntity<LedgerTransaction> recordPayment(
            @PathVariable String playerId,
            @Valid @RequestBody PaymentRequest request) {
        LedgerTransaction transaction = playerService.recordPayment(playerId, request.amount(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(transaction);
    }
}
