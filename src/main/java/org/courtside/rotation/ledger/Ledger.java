package org.courtside.rotation.ledger;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Player balances and the transactions that moved them.
 *
 * <p>Session charges are reversible: {@link #reverseCharges(String)} writes a compensating
 * transaction for every charge and adjustment of the session, restoring prior balances.
 * All methods are synchronized; a single instance is shared by the session service.
 */
public class Ledger {

    private static final Logger logger = LoggerFactory.getLogger(Ledger.class);
    private static final BigDecimal NEGLIGIBLE = new BigDecimal("0.01");

    private final Map<String, PlayerAccount> accounts = new LinkedHashMap<>();
    private final List<LedgerTransaction> transactions = new ArrayList<>();

    public Ledger() {}

    public static Ledger fromSnapshot(LedgerSnapshot snapshot) {
        Ledger ledger = new Ledger();
        for (PlayerAccount account : snapshot.accounts()) {
            ledger.accounts.put(account.id(), account);
        }
        ledger.transactions.addAll(snapshot.transactions());
        return ledger;
    }

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(ImmutableList.copyOf(accounts.values()), ImmutableList.copyOf(transactions));
    }

    /**
     * Opens an account with a zero balance.
     *
     * @throws IllegalArgumentException if the id is already registered
     */
    public synchronized PlayerAccount register(String playerId, String name) {
        if (accounts.containsKey(playerId)) {
            throw new IllegalArgumentException("Player already registered: " + playerId);
        }
        PlayerAccount account = new PlayerAccount(playerId, name, BigDecimal.ZERO.setScale(CostCalculator.MONEY_SCALE), 0);
        accounts.put(playerId, account);
        return account;
    }

    public synchronized Optional<PlayerAccount> account(String playerId) {
        return Optional.ofNullable(accounts.get(playerId));
    }

    public synchronized PlayerAccount requireAccount(String playerId) {
        PlayerAccount account = accounts.get(playerId);
        if (account == null) {
            throw new PlayerNotFoundException(playerId);
        }
        return account;
    }

    public synchronized List<PlayerAccount> accounts() {
        return ImmutableList.copyOf(accounts.values());
    }

    public synchronized List<LedgerTransaction> transactions() {
        return ImmutableList.copyOf(transactions);
    }

    public synchronized List<LedgerTransaction> transactionsFor(String sessionId) {
        return transactions.stream()
            .filter(t -> sessionId.equals(t.sessionId()))
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * Credits a payment to the player's balance.
     */
    public synchronized LedgerTransaction recordPayment(String playerId, BigDecimal amount, String description) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive, got " + amount);
        }
        return post(playerId, CostCalculator.money(amount), 0, TransactionType.PAYMENT, description, null, null);
    }

    /**
     * Charges every player of the breakdown and adds their games to the lifetime count.
     * Fails without changing anything if any player has no account.
     */
    public synchronized List<LedgerTransaction> applyCharges(String sessionId, LocalDate sessionDate,
                                                             SessionBreakdown breakdown) {
        breakdown.playerCharges().keySet().forEach(this::requireAccount);

        List<LedgerTransaction> posted = new ArrayList<>();
        breakdown.playerCharges().forEach((playerId, charge) -> posted.add(post(
            playerId,
            charge.amountOwed().negate(),
            charge.gamesPlayed(),
            TransactionType.GAME_CHARGE,
            charge.gamesPlayed() + " games played - Session " + sessionDate,
            sessionId,
            null)));
        logger.info("Applied {} charges for session {} totalling {}",
            posted.size(), sessionId, breakdown.totalCost());
        return posted;
    }

    /**
     * Applies the per-player differences of an edited session, skipping those under one cent.
     */
    public synchronized List<LedgerTransaction> adjustCharges(String sessionId, LocalDate sessionDate,
                                                              CostAdjustment adjustment) {
        adjustment.differences().keySet().forEach(this::requireAccount);

        List<LedgerTransaction> posted = new ArrayList<>();
        adjustment.differences().forEach((playerId, diff) -> {
            if (diff.difference().abs().compareTo(NEGLIGIBLE) < 0) {
                return;
            }
            posted.add(post(playerId, diff.difference().negate(), 0, TransactionType.ADJUSTMENT,
                "Session cost adjustment - " + sessionDate, sessionId, null));
        });
        return posted;
    }

    /**
     * Cancels every charge and adjustment of the session that has not been reversed yet.
     * Lifetime game counts are left alone; see {@link #subtractGames(Map)}.
     *
     * @return number of reversal transactions written
     */
    public synchronized int reverseCharges(String sessionId) {
        Set<String> alreadyReversed = new HashSet<>();
        for (LedgerTransaction t : transactions) {
            if (t.reverses() != null) {
                alreadyReversed.add(t.reverses());
            }
        }

        List<LedgerTransaction> toReverse = transactions.stream()
            .filter(t -> sessionId.equals(t.sessionId()))
            .filter(t -> t.type() == TransactionType.GAME_CHARGE || t.type() == TransactionType.ADJUSTMENT)
            .filter(t -> !alreadyReversed.contains(t.id()))
            .toList();

        for (LedgerTransaction t : toReverse) {
            post(t.playerId(), t.amount().negate(), 0, TransactionType.REVERSAL,
                "Reversal: " + t.description(), sessionId, t.id());
        }
        logger.info("Reversed {} transactions for session {}", toReverse.size(), sessionId);
        return toReverse.size();
    }

    /**
     * Removes games from lifetime counts, never going below zero.
     */
    public synchronized void subtractGames(Map<String, Integer> playerGames) {
        playerGames.keySet().forEach(this::requireAccount);
        playerGames.forEach((playerId, games) ->
            accounts.computeIfPresent(playerId, (id, account) -> account.withChange(BigDecimal.ZERO, -games)));
    }

    /**
     * Deletes all transactions that belong to the session. Balances are not touched.
     */
    public synchronized int removeTransactions(String sessionId) {
        int before = transactions.size();
        transactions.removeIf(t -> sessionId.equals(t.sessionId()));
        return before - transactions.size();
    }

    private LedgerTransaction post(String playerId, BigDecimal amount, int games, TransactionType type,
                                   String description, String sessionId, String reverses) {
        PlayerAccount account = requireAccount(playerId);
        accounts.put(playerId, account.withChange(amount, games));
        LedgerTransaction transaction = new LedgerTransaction(
            UUID.randomUUID().toString(), playerId, amount, type, description, sessionId, reverses);
        transactions.add(transaction);
        return transaction;
    }
}
