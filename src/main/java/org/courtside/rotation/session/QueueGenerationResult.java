package org.courtside.rotation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.courtside.rotation.scheduler.GeneratedQueue;

import java.util.List;

/**
 * Games added to a session by one queue generation, and why generation stopped.
 */
public record QueueGenerationResult(
    @JsonProperty("games") List<SessionGame> games,
    @JsonProperty("termination") GeneratedQueue.Termination termination
) {

    public boolean notEnoughPlayers() {
        return termination == GeneratedQueue.Termination.INSUFFICIENT_PARTICIPANTS;
    }
}
