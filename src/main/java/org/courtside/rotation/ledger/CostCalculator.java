package org.courtside.rotation.ledger;

import org.courtside.rotation.scheduler.MatchRecord;
import org.courtside.rotation.scheduler.MatchStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session cost arithmetic: totals, per-game and per-player rates, and player charges.
 *
 * <p>Rates keep six decimals; amounts are rounded to cents, half up. Player charges sum to
 * the total cost up to that rounding.
 */
public final class CostCalculator {

    public static final int MONEY_SCALE = 2;
    static final int RATE_SCALE = 6;
    private static final BigDecimal DOZEN = BigDecimal.valueOf(12);
    private static final BigDecimal PLAYERS_PER_GAME = BigDecimal.valueOf(4);

    private CostCalculator() {}

    /**
     * Court fee plus {@code shuttlecocksUsed / 12} dozens at the per-dozen price.
     */
    public static BigDecimal totalCost(SessionCosts costs) {
        BigDecimal shuttlecocks = costs.shuttlecockPrice()
            .multiply(BigDecimal.valueOf(costs.shuttlecocksUsed()))
            .divide(DOZEN, RATE_SCALE, RoundingMode.HALF_UP);
        return money(costs.courtFee().add(shuttlecocks));
    }

    public static BigDecimal costPerGame(BigDecimal totalCost, int totalGames) {
        if (totalGames == 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE);
        }
        return totalCost.divide(BigDecimal.valueOf(totalGames), RATE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal costPerPlayer(BigDecimal costPerGame) {
        return costPerGame.divide(PLAYERS_PER_GAME, RATE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Games per player id across the given matches, in order of first appearance.
     */
    public static Map<String, Integer> playerGameCounts(List<MatchRecord> matches) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (MatchRecord match : matches) {
            for (String id : match.playerIds()) {
                counts.merge(id, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Charges for every player who appears in a completed match. Matches that are not
     * completed are ignored.
     */
    public static SessionBreakdown breakdown(SessionCosts costs, List<MatchRecord> matches) {
        List<MatchRecord> completed = completedOnly(matches);
        BigDecimal total = totalCost(costs);
        BigDecimal perGame = costPerGame(total, completed.size());
        BigDecimal perPlayer = costPerPlayer(perGame);

        Map<String, PlayerCharge> charges = new LinkedHashMap<>();
        playerGameCounts(completed).forEach((playerId, games) ->
            charges.put(playerId, new PlayerCharge(games, charge(games, perPlayer))));

        return new SessionBreakdown(total, money(perGame), perPlayer, completed.size(), charges);
    }

    /**
     * Per-player charge changes when a completed session's costs are edited.
     */
    public static CostAdjustment costDifference(SessionCosts oldCosts, SessionCosts newCosts,
                                                List<MatchRecord> matches) {
        List<MatchRecord> completed = completedOnly(matches);
        BigDecimal oldTotal = totalCost(oldCosts);
        BigDecimal oldPerPlayer = costPerPlayer(costPerGame(oldTotal, completed.size()));
        BigDecimal newTotal = totalCost(newCosts);
        BigDecimal newPerGame = costPerGame(newTotal, completed.size());
        BigDecimal newPerPlayer = costPerPlayer(newPerGame);

        Map<String, ChargeDifference> differences = new LinkedHashMap<>();
        playerGameCounts(completed).forEach((playerId, games) -> {
            BigDecimal oldCharge = charge(games, oldPerPlayer);
            BigDecimal newCharge = charge(games, newPerPlayer);
            differences.put(playerId,
                new ChargeDifference(games, oldCharge, newCharge, newCharge.subtract(oldCharge)));
        });
        return new CostAdjustment(oldTotal, newTotal, money(newPerGame), differences);
    }

    static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal charge(int games, BigDecimal perPlayer) {
        return money(perPlayer.multiply(BigDecimal.valueOf(games)));
    }

    private static List<MatchRecord> completedOnly(List<MatchRecord> matches) {
        return matches.stream()
            .filter(m -> m.status() == MatchStatus.COMPLETED)
            .toList();
    }
}
