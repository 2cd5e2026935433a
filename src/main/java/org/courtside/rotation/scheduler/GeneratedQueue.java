package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Output of one queue-generation call.
 *
 * @param matches     winning candidates in queue order
 * @param usage       final queue-usage counter per active participant
 * @param termination why the round loop stopped
 */
public record GeneratedQueue(
    @JsonProperty("matches") List<Candidate> matches,
    @JsonProperty("usage") Map<String, Integer> usage,
    @JsonProperty("termination") Termination termination
) {

    public enum Termination {
        /** Fewer than four active participants; no round was scored. */
        INSUFFICIENT_PARTICIPANTS,
        /** The configured number of rounds was produced. */
        ROUND_LIMIT,
        /** A round found no eligible candidate. */
        EXHAUSTED
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    public int size() {
        return matches.size();
    }
}
