package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * What a session cost to run.
 *
 * @param courtFee          court rental fee
 * @param shuttlecockPrice  price per dozen shuttlecocks
 * @param shuttlecocksUsed  number of shuttlecocks used
 */
public record SessionCosts(
    @JsonProperty("courtFee") BigDecimal courtFee,
    @JsonProperty("shuttlecockPrice") BigDecimal shuttlecockPrice,
    @JsonProperty("shuttlecocksUsed") int shuttlecocksUsed
) {

    public static final SessionCosts NONE = new SessionCosts(BigDecimal.ZERO, BigDecimal.ZERO, 0);

    public SessionCosts {
        courtFee = courtFee == null ? BigDecimal.ZERO : courtFee;
        shuttlecockPrice = shuttlecockPrice == null ? BigDecimal.ZERO : shuttlecockPrice;
        if (courtFee.signum() < 0 || shuttlecockPrice.signum() < 0 || shuttlecocksUsed < 0) {
            throw new IllegalArgumentException("Session costs must not be negative");
        }
    }
}
