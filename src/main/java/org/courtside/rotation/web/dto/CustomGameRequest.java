package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * DTO for a hand-picked game: two teams of two player ids.
 */
public record CustomGameRequest(
    @JsonProperty("teamA") @NotNull @Size(min = 2, max = 2) List<@NotBlank String> teamA,
    @JsonProperty("teamB") @NotNull @Size(min = 2, max = 2) List<@NotBlank String> teamB
) {}
