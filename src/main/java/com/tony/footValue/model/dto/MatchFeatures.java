package com.tony.footValue.model.dto;

import com.opencsv.bean.CsvBindByName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ligne de features d'un match, calculée uniquement sur les données antérieures au coup d'envoi.
 * Tout changement de colonnes passe par une nouvelle {@code schemaVersion}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchFeatures {

    @CsvBindByName(column = "schema_version") private String schemaVersion;
    @CsvBindByName(column = "match_id") private Long matchId;
    @CsvBindByName(column = "league_id") private Long leagueId;
    @CsvBindByName(column = "match_date") private String matchDate;
    @CsvBindByName(column = "home_team_id") private Long homeTeamId;
    @CsvBindByName(column = "away_team_id") private Long awayTeamId;

    // --- Forme (5 derniers, pondérée) ---
    @CsvBindByName(column = "home_form_points") private int homeFormPoints;
    @CsvBindByName(column = "away_form_points") private int awayFormPoints;
    @CsvBindByName(column = "home_weighted_points") private double homeWeightedPoints;
    @CsvBindByName(column = "away_weighted_points") private double awayWeightedPoints;
    @CsvBindByName(column = "home_goals_for") private int homeGoalsFor;
    @CsvBindByName(column = "home_goals_against") private int homeGoalsAgainst;
    @CsvBindByName(column = "away_goals_for") private int awayGoalsFor;
    @CsvBindByName(column = "away_goals_against") private int awayGoalsAgainst;
    @CsvBindByName(column = "home_goal_difference") private int homeGoalDifference;
    @CsvBindByName(column = "away_goal_difference") private int awayGoalDifference;

    // --- Forme selon le lieu (domicile à domicile, extérieur à l'extérieur) ---
    @CsvBindByName(column = "home_venue_weighted_points") private double homeVenueWeightedPoints;
    @CsvBindByName(column = "away_venue_weighted_points") private double awayVenueWeightedPoints;

    // --- Stats de buts (10 derniers) ---
    @CsvBindByName(column = "home_points_per_game") private double homePointsPerGame;
    @CsvBindByName(column = "away_points_per_game") private double awayPointsPerGame;
    @CsvBindByName(column = "home_attack") private double homeAttack;
    @CsvBindByName(column = "home_defense") private double homeDefense;
    @CsvBindByName(column = "away_attack") private double awayAttack;
    @CsvBindByName(column = "away_defense") private double awayDefense;
    @CsvBindByName(column = "home_attack_at_home") private double homeAttackAtHome;
    @CsvBindByName(column = "home_defense_at_home") private double homeDefenseAtHome;
    @CsvBindByName(column = "away_attack_away") private double awayAttackAway;
    @CsvBindByName(column = "away_defense_away") private double awayDefenseAway;
    @CsvBindByName(column = "home_clean_sheet_rate") private double homeCleanSheetRate;
    @CsvBindByName(column = "away_clean_sheet_rate") private double awayCleanSheetRate;
    @CsvBindByName(column = "home_btts_rate") private double homeBttsRate;
    @CsvBindByName(column = "away_btts_rate") private double awayBttsRate;
    @CsvBindByName(column = "home_over25_rate") private double homeOver25Rate;
    @CsvBindByName(column = "away_over25_rate") private double awayOver25Rate;
    @CsvBindByName(column = "home_failed_to_score_rate") private double homeFailedToScoreRate;
    @CsvBindByName(column = "away_failed_to_score_rate") private double awayFailedToScoreRate;

    // --- H2H (point de vue domicile) ---
    @CsvBindByName(column = "h2h_matches") private int h2hMatches;
    @CsvBindByName(column = "h2h_home_wins") private int h2hHomeWins;
    @CsvBindByName(column = "h2h_draws") private int h2hDraws;
    @CsvBindByName(column = "h2h_away_wins") private int h2hAwayWins;
    @CsvBindByName(column = "h2h_avg_total_goals") private double h2hAvgTotalGoals;

    // --- Classement, avancement de saison, repos, série ---
    @CsvBindByName(column = "season_progress") private double seasonProgress;
    @CsvBindByName(column = "home_position") private int homePosition;
    @CsvBindByName(column = "away_position") private int awayPosition;
    @CsvBindByName(column = "home_rest_days") private int homeRestDays;
    @CsvBindByName(column = "away_rest_days") private int awayRestDays;
    @CsvBindByName(column = "home_streak") private int homeStreak;
    @CsvBindByName(column = "away_streak") private int awayStreak;

    // --- Elo d'avant-match ---
    @CsvBindByName(column = "home_elo") private double homeElo;
    @CsvBindByName(column = "away_elo") private double awayElo;
    @CsvBindByName(column = "elo_diff") private double eloDiff;
    @CsvBindByName(column = "elo_expected_home") private double eloExpectedHome;

    // --- Cible (null pour un match à venir) ---
    @CsvBindByName(column = "result") private String result;
    @CsvBindByName(column = "home_goals") private Integer homeGoals;
    @CsvBindByName(column = "away_goals") private Integer awayGoals;
}
