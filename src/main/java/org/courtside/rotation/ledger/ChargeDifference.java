package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Change in one player's charge after a session's costs were edited.
 * A positive difference means the player owes more.
 */
public record ChargeDifference(
    @JsonProperty("gamesPlayed") int gamesPlayed,
    @JsonProperty("oldCharge") BigDecimal oldCharge,
    @JsonProperty("newCharge") BigDecimal newCharge,
    @JsonProperty("difference") BigDecimal difference
) {}
