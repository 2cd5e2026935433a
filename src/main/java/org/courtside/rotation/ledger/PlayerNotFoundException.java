package org.courtside.rotation.ledger;

/**
 * Thrown when a player id has no ledger account.
 */
public class PlayerNotFoundException extends RuntimeException {
    public PlayerNotFoundException(String playerId) {
        super("Player not found: " + playerId);
    }
}
