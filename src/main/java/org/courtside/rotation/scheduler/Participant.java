package org.courtside.rotation.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A player eligible for queue generation.
 *
 * @param id                    unique identifier
 * @param name                  display name
 * @param lifetimeMatchesPlayed total completed matches across all sessions, owned by the ledger
 */
public record Participant(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("lifetimeMatchesPlayed") int lifetimeMatchesPlayed
) {

    public Participant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
        if (lifetimeMatchesPlayed < 0) {
            throw new IllegalArgumentException(
                "Lifetime matches played must not be negative for participant " + id);
        }
    }

    /**
     * Convenience constructor for a participant with no recorded matches.
     */
    public Participant(String id, String name) {
        this(id, name, 0);
    }
}
