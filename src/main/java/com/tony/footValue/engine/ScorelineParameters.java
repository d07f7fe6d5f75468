package com.tony.footValue.engine;

/**
 * Constantes du modèle de scores corrélé.
 */
public record ScorelineParameters(double rho,
                                  double homeAdvantageGoals,
                                  int maxGoals,
                                  double minHomeLambda,
                                  double maxHomeLambda,
                                  double minAwayLambda,
                                  double maxAwayLambda,
                                  double defaultLeagueAvgHome,
                                  double defaultLeagueAvgAway) {

    public static ScorelineParameters defaults() {
        return new ScorelineParameters(-0.13, 0.25, 8, 0.3, 4.0, 0.3, 3.5, 1.5, 1.2);
    }
}
