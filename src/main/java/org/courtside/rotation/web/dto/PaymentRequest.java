package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * DTO for crediting a payment to a player's balance.
 */
public record PaymentRequest(
    @JsonProperty("amount") @NotNull @Positive BigDecimal amount,
    @JsonProperty("description") String description
) {}
