package com.tony.footValue.config;

import com.tony.footValue.engine.EloParameters;
import com.tony.footValue.engine.ScorelineParameters;
import com.tony.footValue.engine.StatsParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "prediction")
@Data
public class PredictionProperties {

    // --- Paramètres Dixon-Coles ---
    private double rho = -0.13;
    private double homeAdvantageGoals = 0.25;
    private int maxGoals = 8;

    // Bornes des buts attendus (évite les extrêmes sur données rares)
    private double minHomeLambda = 0.3;
    private double maxHomeLambda = 4.0;
    private double minAwayLambda = 0.3;
    private double maxAwayLambda = 3.5;

    // Moyennes de ligue de secours (historique vide)
    private double defaultLeagueAvgHome = 1.5;
    private double defaultLeagueAvgAway = 1.2;

    // --- Elo ---
    private double initialRating = 1500.0;
    private double eloKFactor = 32.0;
    private double homeBonus = 100.0;

    // --- Fenêtres de forme ---
    private double decay = 0.85;
    private int formWindow = 5;
    private int goalStatsWindow = 10;
    private int headToHeadWindow = 5;
    private int defaultLeagueSize = 20;
    private int defaultRestDays = 14;
    private int maxRestDays = 30;

    // --- Snapshot ---
    private String featureSchemaVersion = "v3";
    private boolean buildSnapshotOnStartup = true;

    public ScorelineParameters toScorelineParameters() {
        return new ScorelineParameters(rho, homeAdvantageGoals, maxGoals,
                minHomeLambda, maxHomeLambda, minAwayLambda, maxAwayLambda,
                defaultLeagueAvgHome, defaultLeagueAvgAway);
    }

    public EloParameters toEloParameters() {
        return new EloParameters(initialRating, eloKFactor, homeBonus);
    }

    public StatsParameters toStatsParameters() {
        return new StatsParameters(decay, defaultLeagueSize, defaultRestDays, maxRestDays);
    }
}
