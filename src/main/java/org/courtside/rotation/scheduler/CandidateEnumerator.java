package org.courtside.rotation.scheduler;

import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Enumerates every 4-participant group of the active list together with its three
 * possible 2v2 splits.
 */
public final class CandidateEnumerator {

    public static final int MATCH_SIZE = 4;
    public static final int SPLITS_PER_GROUP = 3;

    private CandidateEnumerator() {}

    /**
     * Total number of candidates for {@code n} participants: {@code 3 * C(n, 4)}.
     */
    public static long candidateCount(int n) {
        return SPLITS_PER_GROUP * Combinations.count(n, MATCH_SIZE);
    }

    /**
     * The three splits of one group: the first member partnered with each of the
     * others in turn, the remaining two forming the opposing team.
     */
    public static List<Candidate> splits(Participant p0, Participant p1, Participant p2, Participant p3) {
        return ImmutableList.of(
            Candidate.of(p0, p1, p2, p3),
            Candidate.of(p0, p2, p1, p3),
            Candidate.of(p0, p3, p1, p2)
        );
    }

    /**
     * Lazily yields all candidates in enumeration order: groups lexicographically by list
     * index, and the three splits of each group consecutively.
     */
    public static FluentIterable<Candidate> enumerate(List<Participant> participants) {
        return FluentIterable.from(new Combinations(participants.size(), MATCH_SIZE))
            .transformAndConcat(group -> splits(
                participants.get(group[0]),
                participants.get(group[1]),
                participants.get(group[2]),
                participants.get(group[3])));
    }
}
