package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A 2v2 match that has been queued, is being played, or has completed.
 * Team lists always hold two distinct ids and never overlap.
 */
public record MatchRecord(
    @JsonProperty("teamA") List<String> teamA,
    @JsonProperty("teamB") List<String> teamB,
    @JsonProperty("status") MatchStatus status
) {

    public MatchRecord {
        teamA = ImmutableList.copyOf(teamA);
        teamB = ImmutableList.copyOf(teamB);
        if (teamA.size() != 2 || teamB.size() != 2) {
            throw new IllegalArgumentException("Each team needs exactly 2 players, got "
                + teamA + " vs " + teamB);
        }
        Set<String> ids = new HashSet<>(teamA);
        ids.addAll(teamB);
        if (ids.size() != 4) {
            throw new IllegalArgumentException("Match players must be distinct: " + teamA + " vs " + teamB);
        }
        if (status == null) {
            throw new IllegalArgumentException("Match status is required");
        }
    }

    public static MatchRecord of(String a1, String a2, String b1, String b2, MatchStatus status) {
        return new MatchRecord(List.of(a1, a2), List.of(b1, b2), status);
    }

    public static MatchRecord completed(String a1, String a2, String b1, String b2) {
        return of(a1, a2, b1, b2, MatchStatus.COMPLETED);
    }

    public boolean onTeamA(String playerId) {
        return teamA.contains(playerId);
    }

    public boolean onTeamB(String playerId) {
        return teamB.contains(playerId);
    }

    public boolean involves(String playerId) {
        return onTeamA(playerId) || onTeamB(playerId);
    }

    /**
     * All four player ids, team A first.
     */
    @JsonIgnore
    public List<String> playerIds() {
        return ImmutableList.<String>builder().addAll(teamA).addAll(teamB).build();
    }

    public MatchRecord withStatus(MatchStatus newStatus) {
        return new MatchRecord(teamA, teamB, newStatus);
    }
}
