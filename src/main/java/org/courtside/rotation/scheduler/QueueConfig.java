package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tuning for one queue-generation call.
 *
 * @param maxQueueRounds    maximum number of matches produced per call
 * @param recencyWindow     trailing matches considered by the recency term
 * @param parallelThreshold candidate count per round from which scoring is spread over the
 *                          builder's executor, if it has one
 */
public record QueueConfig(
    @JsonProperty("maxQueueRounds") int maxQueueRounds,
    @JsonProperty("recencyWindow") int recencyWindow,
    @JsonProperty("parallelThreshold") int parallelThreshold
) {

    public static final int DEFAULT_MAX_QUEUE_ROUNDS = 3;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 20_000;

    public static final QueueConfig DEFAULTS = new QueueConfig(DEFAULT_MAX_QUEUE_ROUNDS);

    public QueueConfig {
        if (maxQueueRounds < 1) {
            throw new IllegalArgumentException("maxQueueRounds must be positive, got " + maxQueueRounds);
        }
        if (recencyWindow < 1) {
            throw new IllegalArgumentException("recencyWindow must be positive, got " + recencyWindow);
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be positive, got " + parallelThreshold);
        }
    }

    /**
     * Convenience constructor with the default recency window and parallel threshold.
     */
    public QueueConfig(int maxQueueRounds) {
        this(maxQueueRounds, RecencyInteractionScorer.DEFAULT_WINDOW, DEFAULT_PARALLEL_THRESHOLD);
    }
}
