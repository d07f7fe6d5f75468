package com.tony.footValue.engine;

/**
 * Confrontations directes, du point de vue de l'équipe A.
 */
public record HeadToHead(long teamAId,
                         long teamBId,
                         int matches,
                         int teamAWins,
                         int draws,
                         int teamBWins,
                         int teamAGoals,
                         int teamBGoals) {

    public static HeadToHead empty(long teamAId, long teamBId) {
        return new HeadToHead(teamAId, teamBId, 0, 0, 0, 0, 0, 0);
    }

    public double avgTeamAGoals() {
        return matches == 0 ? 0.0 : (double) teamAGoals / matches;
    }

    public double avgTeamBGoals() {
        return matches == 0 ? 0.0 : (double) teamBGoals / matches;
    }
}
