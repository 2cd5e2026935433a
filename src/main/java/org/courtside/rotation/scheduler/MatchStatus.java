package org.courtside.rotation.scheduler;

/**
 * Lifecycle of a match record.
 */
public enum MatchStatus {
    QUEUED,
    PLAYING,
    COMPLETED
}
