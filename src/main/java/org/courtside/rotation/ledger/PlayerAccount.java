package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A registered player's balance and lifetime game count.
 * A negative balance means the player owes money.
 */
public record PlayerAccount(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("balance") BigDecimal balance,
    @JsonProperty("totalGamesPlayed") int totalGamesPlayed
) {

    PlayerAccount withChange(BigDecimal balanceChange, int gamesChange) {
        return new PlayerAccount(id, name, balance.add(balanceChange),
            Math.max(0, totalGamesPlayed + gamesChange));
    }
}
