package org.courtside.rotation.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.courtside.rotation.ledger.SessionCosts;

import java.math.BigDecimal;

/**
 * DTO for session costs saved as settings, entered when a session ends, or used to re-price it.
 */
public record SessionCostsRequest(
    @JsonProperty("courtFee") @NotNull @PositiveOrZero BigDecimal courtFee,
    @JsonProperty("shuttlecockPrice") @NotNull @PositiveOrZero BigDecimal shuttlecockPrice,
    @JsonProperty("shuttlecocksUsed") @Min(0) int shuttlecocksUsed
) {

    public SessionCosts toCosts() {
        return new SessionCosts(courtFee, shuttlecockPrice, shuttlecocksUsed);
    }
}
