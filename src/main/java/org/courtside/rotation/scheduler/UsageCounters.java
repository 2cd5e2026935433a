package org.courtside.rotation.scheduler;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-call accumulator counting how many times each active participant has been placed
 * into the queue being built. Counters start at zero and only ever increase.
 * Not thread-safe; owned by a single {@link QueueBuilder} invocation.
 */
public final class UsageCounters {

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    private UsageCounters() {}

    public static UsageCounters forParticipants(List<Participant> participants) {
        UsageCounters counters = new UsageCounters();
        for (Participant p : participants) {
            counters.counts.put(p.id(), 0);
        }
        return counters;
    }

    public int get(String participantId) {
        Integer count = counts.get(participantId);
        if (count == null) {
            throw new IllegalArgumentException("Unknown participant: " + participantId);
        }
        return count;
    }

    /**
     * Adds one placement for every participant of the committed candidate.
     */
    public void recordPlacement(Candidate candidate) {
        for (String id : candidate.participantIds()) {
            counts.put(id, get(id) + 1);
        }
    }

    public int minimum() {
        return counts.isEmpty() ? 0 : Collections.min(counts.values());
    }

    public int maximum() {
        return counts.isEmpty() ? 0 : Collections.max(counts.values());
    }

    public Set<String> participantsAt(int usage) {
        ImmutableSet.Builder<String> ids = ImmutableSet.builder();
        counts.forEach((id, count) -> {
            if (count == usage) {
                ids.add(id);
            }
        });
        return ids.build();
    }

    public ImmutableMap<String, Integer> snapshot() {
        return ImmutableMap.copyOf(counts);
    }
}
