package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.List;

/**
 * A proposed 2v2 match: four distinct participants with one specific team split.
 */
public record Candidate(
    @JsonProperty("teamA") List<Participant> teamA,
    @JsonProperty("teamB") List<Participant> teamB
) {

    public Candidate {
        teamA = ImmutableList.copyOf(teamA);
        teamB = ImmutableList.copyOf(teamB);
        if (teamA.size() != 2 || teamB.size() != 2) {
            throw new IllegalArgumentException("Each team needs exactly 2 participants");
        }
        if (ImmutableSortedSet.copyOf(idsOf(teamA, teamB)).size() != 4) {
            throw new IllegalArgumentException("Candidate participants must be distinct");
        }
    }

    public static Candidate of(Participant a1, Participant a2, Participant b1, Participant b2) {
        return new Candidate(List.of(a1, a2), List.of(b1, b2));
    }

    /**
     * All four participants, team A first.
     */
    @JsonIgnore
    public List<Participant> participants() {
        return ImmutableList.<Participant>builder().addAll(teamA).addAll(teamB).build();
    }

    @JsonIgnore
    public List<String> participantIds() {
        return idsOf(teamA, teamB);
    }

    /**
     * The sorted id set of the four participants, independent of the team split.
     */
    @JsonIgnore
    public ImmutableSortedSet<String> groupKey() {
        return ImmutableSortedSet.copyOf(participantIds());
    }

    /**
     * Converts this candidate into a queued match record.
     */
    public MatchRecord toMatchRecord() {
        return new MatchRecord(
            List.of(teamA.get(0).id(), teamA.get(1).id()),
            List.of(teamB.get(0).id(), teamB.get(1).id()),
            MatchStatus.QUEUED);
    }

    @Override
    public String toString() {
        return teamA.get(0).id() + " & " + teamA.get(1).id()
            + " vs " + teamB.get(0).id() + " & " + teamB.get(1).id();
    }

    private static List<String> idsOf(List<Participant> teamA, List<Participant> teamB) {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        teamA.forEach(p -> ids.add(p.id()));
        teamB.forEach(p -> ids.add(p.id()));
        return ids.build();
    }
}
