package org.courtside.rotation.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * What deleting a session would undo.
 *
 * @param totalCharges charges applied at completion, zero for sessions still in progress
 * @param playerGames  completed games per player
 */
public record DeletionImpact(
    @JsonProperty("sessionDate") LocalDate sessionDate,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("playersAffected") int playersAffected,
    @JsonProperty("totalGames") int totalGames,
    @JsonProperty("completedGames") int completedGames,
    @JsonProperty("totalCharges") BigDecimal totalCharges,
    @JsonProperty("playerGames") Map<String, Integer> playerGames
) {}
