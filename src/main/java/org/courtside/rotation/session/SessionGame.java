package org.courtside.rotation.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.courtside.rotation.scheduler.MatchRecord;
import org.courtside.rotation.scheduler.MatchStatus;

/**
 * A numbered game within a session.
 *
 * @param gameNumber sequential number assigned when the game was queued
 * @param match      teams and lifecycle status
 * @param custom     true when entered by hand rather than generated
 */
public record SessionGame(
    @JsonProperty("gameNumber") int gameNumber,
    @JsonProperty("match") MatchRecord match,
    @JsonProperty("custom") boolean custom
) {

    public MatchStatus status() {
        return match.status();
    }

    public SessionGame withStatus(MatchStatus status) {
        return new SessionGame(gameNumber, match.withStatus(status), custom);
    }
}
