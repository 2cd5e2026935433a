package org.courtside.rotation.scheduler;

import java.util.List;

/**
 * Counts teammate and opponent occurrences of a pair across a set of match records.
 */
public final class PairingHistoryAnalyzer {

    private PairingHistoryAnalyzer() {}

    /**
     * Scans every match: same team counts as teammates, opposite teams as opponents,
     * and matches missing either participant are ignored. A participant never pairs with
     * themself, so {@code p1.equals(p2)} yields {@link PairingHistory#NONE}.
     *
     * @param p1      first participant id
     * @param p2      second participant id
     * @param matches match records to scan
     * @return teammate and opponent counts
     */
    public static PairingHistory pairingHistory(String p1, String p2, List<MatchRecord> matches) {
        if (p1.equals(p2)) {
            return PairingHistory.NONE;
        }
        int teammates = 0;
        int opponents = 0;
        for (MatchRecord match : matches) {
            boolean p1InA = match.onTeamA(p1);
            boolean p1InB = match.onTeamB(p1);
            boolean p2InA = match.onTeamA(p2);
            boolean p2InB = match.onTeamB(p2);

            if ((p1InA && p2InA) || (p1InB && p2InB)) {
                teammates++;
            } else if ((p1InA && p2InB) || (p1InB && p2InA)) {
                opponents++;
            }
        }
        return new PairingHistory(teammates, opponents);
    }
}
