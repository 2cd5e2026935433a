package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RegisterPlayerRequest(
    @JsonProperty("name") @NotBlank String name
) {}
