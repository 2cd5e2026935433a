package org.courtside.rotation.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionPlayer(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("status") PlayerStatus status
) {}
