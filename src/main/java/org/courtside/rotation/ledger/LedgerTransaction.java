package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One balance movement. Positive amounts credit the player, negative amounts charge them.
 *
 * @param sessionId  owning session, or {@code null} for payments
 * @param reverses   id of the transaction this one cancels, or {@code null}
 */
public record LedgerTransaction(
    @JsonProperty("id") String id,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("amount") BigDecimal amount,
    @JsonProperty("type") TransactionType type,
    @JsonProperty("description") String description,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("reverses") String reverses
) {}
