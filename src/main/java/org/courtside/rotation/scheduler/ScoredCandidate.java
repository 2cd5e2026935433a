package org.courtside.rotation.scheduler;

/**
 * A candidate with its composite score and its position in enumeration order.
 * Ordering is by score, then by enumeration index, so the earliest candidate wins ties.
 */
public record ScoredCandidate(Candidate candidate, long score, int enumerationIndex)
        implements Comparable<ScoredCandidate> {

    @Override
    public int compareTo(ScoredCandidate other) {
        int cmp = Long.compare(score, other.score);
        return cmp != 0 ? cmp : Integer.compare(enumerationIndex, other.enumerationIndex);
    }

    /**
     * Returns whichever of the two ranks first; either argument may be null.
     */
    static ScoredCandidate better(ScoredCandidate a, ScoredCandidate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) <= 0 ? a : b;
    }
}
