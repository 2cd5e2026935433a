package org.courtside.rotation.scheduler;

import java.util.List;

/**
 * Composite weighted-sum scorer.
 *
 * <p>Terms, in priority order:
 * <ol>
 *   <li>participants at the global minimum usage (subtracted)</li>
 *   <li>usage spread inside the group</li>
 *   <li>total usage of the group</li>
 *   <li>teammate repeats for both teams</li>
 *   <li>opponent repeats across the four cross-team pairs</li>
 *   <li>lifetime matches played</li>
 *   <li>recent co-occurrence of all six pairs</li>
 * </ol>
 */
public class WeightedMatchScorer implements MatchScorer {

    private final ScoringWeights weights;

    public WeightedMatchScorer() {
        this(ScoringWeights.DEFAULTS);
    }

    public WeightedMatchScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoringWeights weights() {
        return weights;
    }

    @Override
    public long score(Candidate candidate, ScoringContext context) {
        List<Participant> players = candidate.participants();
        long score = 0;

        int atMinimum = 0;
        int minInGroup = Integer.MAX_VALUE;
        int maxInGroup = Integer.MIN_VALUE;
        int usageSum = 0;
        long lifetimeSum = 0;
        for (Participant p : players) {
            int usage = context.usageOf(p.id());
            if (usage == context.minimumUsage()) {
                atMinimum++;
            }
            minInGroup = Math.min(minInGroup, usage);
            maxInGroup = Math.max(maxInGroup, usage);
            usageSum += usage;
            lifetimeSum += p.lifetimeMatchesPlayed();
        }
        score -= atMinimum * weights.underusedBonus();
        score += (long) (maxInGroup - minInGroup) * weights.usageSpread();
        score += usageSum * weights.totalUsage();

        List<Participant> teamA = candidate.teamA();
        List<Participant> teamB = candidate.teamB();
        int teammateRepeats = context.pairing(teamA.get(0).id(), teamA.get(1).id()).teammates()
            + context.pairing(teamB.get(0).id(), teamB.get(1).id()).teammates();
        score += teammateRepeats * weights.teammateRepeat();

        int opponentRepeats = 0;
        for (Participant a : teamA) {
            for (Participant b : teamB) {
                opponentRepeats += context.pairing(a.id(), b.id()).opponents();
            }
        }
        score += opponentRepeats * weights.opponentRepeat();

        score += lifetimeSum * weights.lifetimeLoad();

        long recency = 0;
        for (int i = 0; i < players.size(); i++) {
            for (int j = i + 1; j < players.size(); j++) {
                recency += context.recency(players.get(i).id(), players.get(j).id());
            }
        }
        score += recency * weights.recency();

        return score;
    }
}
