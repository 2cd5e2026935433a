package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

public record CostAdjustment(
    @JsonProperty("oldTotalCost") BigDecimal oldTotalCost,
    @JsonProperty("newTotalCost") BigDecimal newTotalCost,
    @JsonProperty("newCostPerGame") BigDecimal newCostPerGame,
    @JsonProperty("differences") Map<String, ChargeDifference> differences
) {}
