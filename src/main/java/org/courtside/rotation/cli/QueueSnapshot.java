package org.courtside.rotation.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.courtside.rotation.scheduler.MatchRecord;
import org.courtside.rotation.scheduler.Participant;

import java.util.List;

/**
 * Input file for the command-line runner: the active participants and every known match,
 * oldest first.
 */
public record QueueSnapshot(
    @JsonProperty("participants") List<Participant> participants,
    @JsonProperty("matches") List<MatchRecord> matches
) {

    public QueueSnapshot {
        participants = participants == null ? List.of() : List.copyOf(participants);
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
