package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record AddPlayerRequest(
    @JsonProperty("playerId") @NotBlank String playerId
) {}
