package org.courtside.rotation.scheduler;

/**
 * Ranks a candidate match. Lower scores are more desirable.
 * Implementations must not mutate the context; they may be called concurrently.
 */
@FunctionalInterface
public interface MatchScorer {

    long score(Candidate candidate, ScoringContext context);
}
