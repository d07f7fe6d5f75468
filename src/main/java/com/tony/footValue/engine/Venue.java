package com.tony.footValue.engine;

/**
 * Filtre de lieu d'une fenêtre de forme.
 */
public enum Venue {
    ALL, HOME, AWAY;

    public boolean accepts(MatchRecord match, long teamId) {
        return switch (this) {
            case ALL -> match.involves(teamId);
            case HOME -> match.homeTeamId() == teamId;
            case AWAY -> match.awayTeamId() == teamId;
        };
    }
}
