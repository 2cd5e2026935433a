package org.courtside.rotation.scheduler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only state shared by every candidate scored in one round.
 *
 * <p>Pair lookups are memoized per round; the caches are concurrent so candidates may be
 * scored from several threads.
 */
public final class ScoringContext {

    private final ImmutableMap<String, Integer> usage;
    private final int minimumUsage;
    private final ImmutableList<MatchRecord> knownMatches;
    private final ImmutableList<MatchRecord> recentMatches;
    private final int recencyWindow;
    private final Map<String, PairingHistory> pairingCache = new ConcurrentHashMap<>();
    private final Map<String, Integer> recencyCache = new ConcurrentHashMap<>();

    /**
     * @param usage         queue-usage counter per active participant
     * @param minimumUsage  lowest counter value across all active participants
     * @param knownMatches  history, previously queued and already committed matches, oldest first
     * @param recencyWindow number of trailing matches considered for recency
     */
    public ScoringContext(Map<String, Integer> usage, int minimumUsage,
                          List<MatchRecord> knownMatches, int recencyWindow) {
        this.usage = ImmutableMap.copyOf(usage);
        this.minimumUsage = minimumUsage;
        this.knownMatches = ImmutableList.copyOf(knownMatches);
        this.recencyWindow = recencyWindow;
        int from = Math.max(0, this.knownMatches.size() - recencyWindow);
        this.recentMatches = this.knownMatches.subList(from, this.knownMatches.size());
    }

    public int usageOf(String participantId) {
        Integer count = usage.get(participantId);
        if (count == null) {
            throw new IllegalArgumentException("No usage counter for participant " + participantId);
        }
        return count;
    }

    public int minimumUsage() {
        return minimumUsage;
    }

    public List<MatchRecord> knownMatches() {
        return knownMatches;
    }

    public List<MatchRecord> recentMatches() {
        return recentMatches;
    }

    public PairingHistory pairing(String p1, String p2) {
        return pairingCache.computeIfAbsent(pairKey(p1, p2),
            key -> PairingHistoryAnalyzer.pairingHistory(p1, p2, knownMatches));
    }

    public int recency(String p1, String p2) {
        return recencyCache.computeIfAbsent(pairKey(p1, p2),
            key -> RecencyInteractionScorer.interactionScore(p1, p2, recentMatches, recencyWindow));
    }

    private static String pairKey(String p1, String p2) {
        return p1.compareTo(p2) <= 0 ? p1 + '\u0000' + p2 : p2 + '\u0000' + p1;
    }
}
