package org.courtside.rotation.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import org.courtside.rotation.ledger.SessionCosts;
import org.courtside.rotation.scheduler.MatchRecord;
import org.courtside.rotation.scheduler.MatchStatus;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One club night: who is playing, and every game queued, played or completed so far.
 *
 * @param costs saved settings while in progress, final costs once completed; {@code null}
 *              until set
 */
public record Session(
    @JsonProperty("id") String id,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("status") SessionStatus status,
    @JsonProperty("players") List<SessionPlayer> players,
    @JsonProperty("games") List<SessionGame> games,
    @JsonProperty("costs") SessionCosts costs
) {

    public Session {
        players = players == null ? List.of() : ImmutableList.copyOf(players);
        games = games == null ? List.of() : ImmutableList.sortedCopyOf(
            Comparator.comparingInt(SessionGame::gameNumber), games);
    }

    public static Session start(String id, LocalDate date) {
        return new Session(id, date, SessionStatus.IN_PROGRESS, List.of(), List.of(), null);
    }

    public Optional<SessionPlayer> player(String playerId) {
        return players.stream().filter(p -> p.playerId().equals(playerId)).findFirst();
    }

    public Optional<SessionGame> game(int gameNumber) {
        return games.stream().filter(g -> g.gameNumber() == gameNumber).findFirst();
    }

    @JsonIgnore
    public List<String> activePlayerIds() {
        return players.stream()
            .filter(p -> p.status() == PlayerStatus.ACTIVE)
            .map(SessionPlayer::playerId)
            .toList();
    }

    public List<SessionGame> gamesWithStatus(MatchStatus status) {
        return games.stream().filter(g -> g.status() == status).toList();
    }

    /**
     * Every game's match in game-number order, which is also chronological order.
     */
    @JsonIgnore
    public List<MatchRecord> matchHistory() {
        return games.stream().map(SessionGame::match).toList();
    }

    @JsonIgnore
    public List<MatchRecord> completedMatches() {
        return gamesWithStatus(MatchStatus.COMPLETED).stream().map(SessionGame::match).toList();
    }

    /**
     * The number the next queued game receives: one past the highest number ever used.
     */
    @JsonIgnore
    public int nextGameNumber() {
        return games.stream().mapToInt(SessionGame::gameNumber).max().orElse(0) + 1;
    }

    public Session withPlayers(List<SessionPlayer> newPlayers) {
        return new Session(id, date, status, newPlayers, games, costs);
    }

    public Session withGames(List<SessionGame> newGames) {
        return new Session(id, date, status, players, newGames, costs);
    }

    public Session withCosts(SessionCosts newCosts) {
        return new Session(id, date, status, players, games, newCosts);
    }

    public Session completed(SessionCosts sessionCosts) {
        return new Session(id, date, SessionStatus.COMPLETED, players, games, sessionCosts);
    }
}
