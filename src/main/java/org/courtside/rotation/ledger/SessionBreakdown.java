package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Financial summary of a completed session.
 *
 * @param totalCost            court fee plus shuttlecocks
 * @param costPerGame          total cost spread over completed games
 * @param costPerPlayerPerGame a quarter of the per-game cost
 * @param totalGames           completed games
 * @param playerCharges        charge per player id, in order of first appearance
 */
public record SessionBreakdown(
    @JsonProperty("totalCost") BigDecimal totalCost,
    @JsonProperty("costPerGame") BigDecimal costPerGame,
    @JsonProperty("costPerPlayerPerGame") BigDecimal costPerPlayerPerGame,
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("playerCharges") Map<String, PlayerCharge> playerCharges
) {}
