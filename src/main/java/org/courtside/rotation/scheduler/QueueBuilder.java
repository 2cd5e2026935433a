package org.courtside.rotation.scheduler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Predicate;

/**
 * Builds a short queue of upcoming 2v2 matches by greedy selection.
 *
 * <p>Each round scores every eligible candidate and commits the lowest-scoring one:
 * <ol>
 *   <li>Participants are ordered by id, so enumeration order (and therefore the
 *       tie-break) does not depend on the order the caller supplied them in</li>
 *   <li>When four or more participants share the minimum usage, candidates with fewer
 *       than three of them are excluded before scoring</li>
 *   <li>A candidate that would push the usage spread past one is not eligible: if it
 *       places anyone above the minimum, it must include every participant at the minimum</li>
 *   <li>A group of four is committed at most once per call; when no group is left the
 *       call returns what it has</li>
 * </ol>
 *
 * <p>Instances are stateless between calls and safe to share. Usage counters live only
 * for the duration of {@link #buildQueue}.
 */
public class QueueBuilder {

    private static final Logger logger = LoggerFactory.getLogger(QueueBuilder.class);

    private static final int MIN_PARTICIPANTS = CandidateEnumerator.MATCH_SIZE;
    private static final int MIN_AT_MINIMUM_PER_MATCH = 3;

    private final QueueConfig config;
    private final MatchScorer scorer;
    private final ExecutorService executor;

    public QueueBuilder() {
        this(QueueConfig.DEFAULTS);
    }

    public QueueBuilder(QueueConfig config) {
        this(config, new WeightedMatchScorer(), null);
    }

    /**
     * @param config   round limit, recency window and parallel threshold
     * @param scorer   candidate scorer
     * @param executor optional pool for scoring large rounds; {@code null} scores on the caller's thread
     */
    public QueueBuilder(QueueConfig config, MatchScorer scorer, ExecutorService executor) {
        this.config = config;
        this.scorer = scorer;
        this.executor = executor;
    }

    public QueueConfig config() {
        return config;
    }

    /**
     * Generates the queue.
     *
     * @param activeParticipants participants eligible for this call, unique ids
     * @param matchUniverse      completed, in-progress and already queued matches, oldest first
     * @return the generated queue; empty when fewer than four participants are active
     * @throws IllegalArgumentException if participant ids repeat
     */
    public GeneratedQueue buildQueue(List<Participant> activeParticipants, List<MatchRecord> matchUniverse) {
        List<Participant> participants = canonicalOrder(activeParticipants);
        UsageCounters usage = UsageCounters.forParticipants(participants);

        if (participants.size() < MIN_PARTICIPANTS) {
            logger.debug("Only {} active participants, no queue generated", participants.size());
            return new GeneratedQueue(List.of(), usage.snapshot(),
                GeneratedQueue.Termination.INSUFFICIENT_PARTICIPANTS);
        }

        List<MatchRecord> knownMatches = new ArrayList<>(matchUniverse);
        Set<ImmutableSortedSet<String>> spentGroups = new HashSet<>();
        List<Candidate> queue = new ArrayList<>();
        GeneratedQueue.Termination termination = GeneratedQueue.Termination.ROUND_LIMIT;

        for (int round = 1; round <= config.maxQueueRounds(); round++) {
            int minimum = usage.minimum();
            Set<String> atMinimum = usage.participantsAt(minimum);
            boolean enforceFairness = atMinimum.size() >= MIN_PARTICIPANTS;
            ScoringContext context = new ScoringContext(
                usage.snapshot(), minimum, knownMatches, config.recencyWindow());

            ScoredCandidate best = selectBest(participants, context,
                candidate -> isEligible(candidate, spentGroups, atMinimum, enforceFairness));
            if (best == null) {
                logger.debug("Round {}: no eligible candidate, stopping with {} matches", round, queue.size());
                termination = GeneratedQueue.Termination.EXHAUSTED;
                break;
            }

            Candidate winner = best.candidate();
            queue.add(winner);
            usage.recordPlacement(winner);
            spentGroups.add(winner.groupKey());
            knownMatches.add(winner.toMatchRecord());
            logger.debug("Round {}: committed {} with score {}", round, winner, best.score());
        }

        return new GeneratedQueue(ImmutableList.copyOf(queue), usage.snapshot(), termination);
    }

    private static boolean isEligible(Candidate candidate, Set<ImmutableSortedSet<String>> spentGroups,
                                      Set<String> atMinimum, boolean enforceFairness) {
        if (spentGroups.contains(candidate.groupKey())) {
            return false;
        }
        int rested = 0;
        boolean placesBusy = false;
        for (String id : candidate.participantIds()) {
            if (atMinimum.contains(id)) {
                rested++;
            } else {
                placesBusy = true;
            }
        }
        // usage spread never exceeds one, so a busy member reaches minimum + 2
        if (placesBusy && rested < atMinimum.size()) {
            return false;
        }
        return !enforceFairness || rested >= MIN_AT_MINIMUM_PER_MATCH;
    }

    private ScoredCandidate selectBest(List<Participant> participants, ScoringContext context,
                                       Predicate<Candidate> eligible) {
        long candidateCount = CandidateEnumerator.candidateCount(participants.size());
        if (executor != null && candidateCount >= config.parallelThreshold()) {
            return selectBestInParallel(participants, context, eligible);
        }
        return bestOf(CandidateEnumerator.enumerate(participants), 0, context, eligible);
    }

    private ScoredCandidate selectBestInParallel(List<Participant> participants, ScoringContext context,
                                                 Predicate<Candidate> eligible) {
        List<Candidate> candidates = CandidateEnumerator.enumerate(participants).toList();
        int chunkSize = Math.max(1, config.parallelThreshold() / 4);

        List<Future<ScoredCandidate>> futures = new ArrayList<>();
        int offset = 0;
        for (List<Candidate> chunk : Lists.partition(candidates, chunkSize)) {
            final int chunkOffset = offset;
            futures.add(executor.submit(() -> bestOf(chunk, chunkOffset, context, eligible)));
            offset += chunk.size();
        }

        ScoredCandidate best = null;
        try {
            for (Future<ScoredCandidate> future : futures) {
                best = ScoredCandidate.better(best, future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while scoring candidates", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Candidate scoring failed", e.getCause());
        }
        return best;
    }

    private ScoredCandidate bestOf(Iterable<Candidate> candidates, int firstIndex, ScoringContext context,
                                   Predicate<Candidate> eligible) {
        ScoredCandidate best = null;
        int index = firstIndex;
        for (Candidate candidate : candidates) {
            if (eligible.test(candidate)) {
                long score = scorer.score(candidate, context);
                if (best == null || score < best.score()) {
                    best = new ScoredCandidate(candidate, score, index);
                }
            }
            index++;
        }
        return best;
    }

    private static List<Participant> canonicalOrder(List<Participant> activeParticipants) {
        Set<String> seen = new HashSet<>();
        for (Participant p : activeParticipants) {
            if (!seen.add(p.id())) {
                throw new IllegalArgumentException("Duplicate participant id: " + p.id());
            }
        }
        List<Participant> sorted = new ArrayList<>(activeParticipants);
        sorted.sort(Comparator.comparing(Participant::id));
        return sorted;
    }
}
