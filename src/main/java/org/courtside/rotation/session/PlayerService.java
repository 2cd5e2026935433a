package org.courtside.rotation.session;

import org.courtside.rotation.ledger.Ledger;
import org.courtside.rotation.ledger.LedgerTransaction;
import org.courtside.rotation.ledger.PlayerAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Player registry backed by the ledger: registration, balances and payments.
 */
@Service
public class PlayerService {

    private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);

    private final Ledger ledger;
    private final SessionStore store;

    public PlayerService(Ledger ledger, SessionStore store) {
        this.ledger = ledger;
        this.store = store;
    }

    /**
     * Registers a player under an id derived from the name, adding a numeric suffix when
     * the id is taken.
     */
    public synchronized PlayerAccount register(String name) {
        String baseId = generatePlayerId(name);
        if (baseId.isEmpty()) {
            throw new IllegalArgumentException("Player name must contain letters or digits: " + name);
        }
        String id = baseId;
        int suffix = 2;
        while (ledger.account(id).isPresent()) {
            id = baseId + "-" + suffix++;
        }
        PlayerAccount account = ledger.register(id, name);
        persist();
        logger.info("Registered player {} ({})", id, name);
        return account;
    }

    public List<PlayerAccount> listPlayers() {
        return ledger.accounts();
    }

    public PlayerAccount getPlayer(String playerId) {
        return ledger.requireAccount(playerId);
    }

    public synchronized LedgerTransaction recordPayment(String playerId, BigDecimal amount, String description) {
        LedgerTransaction transaction = ledger.recordPayment(playerId, amount,
            description == null || description.isBlank() ? "Payment" : description);
        persist();
        return transaction;
    }

    public List<LedgerTransaction> transactionsFor(String playerId) {
        ledger.requireAccount(playerId);
        return ledger.transactions().stream()
            .filter(t -> t.playerId().equals(playerId))
            .toList();
    }

    static String generatePlayerId(String name) {
        return name.trim().toLowerCase().replaceAll("[^a-z0-9]+", "-").replaceAll("^-|-$", "");
    }

    private void persist() {
        try {
            store.saveLedger(ledger.snapshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save ledger", e);
        }
    }
}
