package org.courtside.rotation.scheduler;

import java.util.List;

/**
 * Scores how recently two participants shared a court, as teammates or opponents alike.
 */
public final class RecencyInteractionScorer {

    /** Number of most recent matches considered. */
    public static final int DEFAULT_WINDOW = 10;

    private RecencyInteractionScorer() {}

    public static int interactionScore(String p1, String p2, List<MatchRecord> recentMatches) {
        return interactionScore(p1, p2, recentMatches, DEFAULT_WINDOW);
    }

    /**
     * Sums {@code (window - distance + 1) * 2} over the last {@code window} matches that
     * include both participants, where distance is 1 for the newest match.
     *
     * @param recentMatches matches ordered oldest to newest
     */
    public static int interactionScore(String p1, String p2, List<MatchRecord> recentMatches, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Recency window must be positive, got " + window);
        }
        int size = recentMatches.size();
        int first = Math.max(0, size - window);
        int score = 0;
        for (int i = first; i < size; i++) {
            MatchRecord match = recentMatches.get(i);
            if (match.involves(p1) && match.involves(p2)) {
                int distanceFromEnd = size - i;
                score += (window - distanceFromEnd + 1) * 2;
            }
        }
        return score;
    }
}
