package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record PlayerCharge(
    @JsonProperty("gamesPlayed") int gamesPlayed,
    @JsonProperty("amountOwed") BigDecimal amountOwed
) {}
