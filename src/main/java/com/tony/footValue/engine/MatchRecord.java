package com.tony.footValue.engine;

import com.tony.footValue.model.MatchStatus;

import java.time.LocalDateTime;
import java.util.Comparator;

/**
 * Projection immuable d'un match, seule forme lue par le moteur.
 */
public record MatchRecord(Long id,
                          Long leagueId,
                          Long homeTeamId,
                          Long awayTeamId,
                          LocalDateTime matchDate,
                          MatchStatus status,
                          Integer homeGoals,
                          Integer awayGoals,
                          Integer round) {

    /** Ordre chronologique strict : date puis identifiant. */
    public static final Comparator<MatchRecord> CHRONOLOGICAL = Comparator
            .comparing(MatchRecord::matchDate)
            .thenComparing(MatchRecord::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public static MatchRecord finished(Long id, Long leagueId, Long homeTeamId, Long awayTeamId,
                                       LocalDateTime matchDate, int homeGoals, int awayGoals) {
        return new MatchRecord(id, leagueId, homeTeamId, awayTeamId, matchDate, MatchStatus.FT,
                homeGoals, awayGoals, null);
    }

    public static MatchRecord scheduled(Long id, Long leagueId, Long homeTeamId, Long awayTeamId,
                                        LocalDateTime matchDate) {
        return new MatchRecord(id, leagueId, homeTeamId, awayTeamId, matchDate, MatchStatus.NS,
                null, null, null);
    }

    public boolean hasScore() {
        return homeGoals != null && awayGoals != null;
    }

    public boolean isFinished() {
        return status != null && status.isFinished() && hasScore();
    }

    public boolean involves(long teamId) {
        return homeTeamId == teamId || awayTeamId == teamId;
    }

    public boolean isHome(long teamId) {
        return homeTeamId == teamId;
    }

    public int goalsFor(long teamId) {
        return isHome(teamId) ? homeGoals : awayGoals;
    }

    public int goalsAgainst(long teamId) {
        return isHome(teamId) ? awayGoals : homeGoals;
    }

    /** 3 / 1 / 0 points du point de vue de l'équipe. */
    public int pointsFor(long teamId) {
        int diff = goalsFor(teamId) - goalsAgainst(teamId);
        if (diff > 0) return 3;
        return diff == 0 ? 1 : 0;
    }

    public int totalGoals() {
        return homeGoals + awayGoals;
    }
}
