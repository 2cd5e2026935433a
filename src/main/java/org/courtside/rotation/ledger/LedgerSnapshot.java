package org.courtside.rotation.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serializable state of a {@link Ledger}.
 */
public record LedgerSnapshot(
    @JsonProperty("accounts") List<PlayerAccount> accounts,
    @JsonProperty("transactions") List<LedgerTransaction> transactions
) {

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(List.of(), List.of());
    }
}
