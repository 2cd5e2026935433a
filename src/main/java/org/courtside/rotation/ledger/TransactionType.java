package org.courtside.rotation.ledger;

public enum TransactionType {
    PAYMENT,
    GAME_CHARGE,
    ADJUSTMENT,
    REVERSAL
}
