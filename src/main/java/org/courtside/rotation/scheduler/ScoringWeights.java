package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights of the composite match score. The defaults keep the priorities strictly ordered:
 * fairness first, then usage balance, then variety, then lifetime load and recency.
 */
public record ScoringWeights(
    @JsonProperty("underusedBonus") long underusedBonus,
    @JsonProperty("usageSpread") long usageSpread,
    @JsonProperty("totalUsage") long totalUsage,
    @JsonProperty("teammateRepeat") long teammateRepeat,
    @JsonProperty("opponentRepeat") long opponentRepeat,
    @JsonProperty("lifetimeLoad") long lifetimeLoad,
    @JsonProperty("recency") long recency
) {

    public static final ScoringWeights DEFAULTS =
        new ScoringWeights(1_000_000, 100_000, 10_000, 5_000, 3_000, 100, 10);
}
