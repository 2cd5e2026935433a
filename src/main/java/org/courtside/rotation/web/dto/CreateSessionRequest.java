package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * DTO for starting a new session.
 */
public record CreateSessionRequest(
    @JsonProperty("date") @NotNull LocalDate date
) {}
