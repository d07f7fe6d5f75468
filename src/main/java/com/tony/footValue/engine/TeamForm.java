package com.tony.footValue.engine;

/**
 * Forme d'une équipe sur une fenêtre de matchs antérieurs à la date de coupure.
 * Sans historique : {@link #neutral()} (zéros partout), jamais une erreur.
 */
public record TeamForm(int matchesPlayed,
                       int wins,
                       int draws,
                       int losses,
                       int goalsFor,
                       int goalsAgainst,
                       int points,
                       double weightedPoints,
                       int cleanSheets,
                       int bttsMatches,
                       int over25Matches,
                       int failedToScore) {

    private static final TeamForm NEUTRAL = new TeamForm(0, 0, 0, 0, 0, 0, 0, 0.0, 0, 0, 0, 0);

    public static TeamForm neutral() {
        return NEUTRAL;
    }

    public boolean isEmpty() {
        return matchesPlayed == 0;
    }

    public int goalDifference() {
        return goalsFor - goalsAgainst;
    }

    public double pointsPerGame() {
        return rate(points);
    }

    public double avgGoalsFor() {
        return rate(goalsFor);
    }

    public double avgGoalsAgainst() {
        return rate(goalsAgainst);
    }

    public double cleanSheetRate() {
        return rate(cleanSheets);
    }

    public double bttsRate() {
        return rate(bttsMatches);
    }

    public double over25Rate() {
        return rate(over25Matches);
    }

    public double failedToScoreRate() {
        return rate(failedToScore);
    }

    private double rate(int count) {
        return matchesPlayed == 0 ? 0.0 : (double) count / matchesPlayed;
    }
}
