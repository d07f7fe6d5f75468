package com.tony.footValue.service;

import com.tony.footValue.config.PredictionProperties;
import com.tony.footValue.engine.EloRatingTracker;
import com.tony.footValue.engine.HeadToHead;
import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.engine.PointInTimeStatsCache;
import com.tony.footValue.engine.TeamForm;
import com.tony.footValue.engine.Venue;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.dto.MatchFeatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Assemble les lignes de features à partir du cache point-in-time et des notes Elo d'avant-match.
 * Le modèle Dixon-Coles n'y figure pas : ses forces sont calculées sur tout l'historique.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureService {

    private final PredictionProperties properties;

    public MatchFeatures buildFeatures(ModelSnapshot snapshot, MatchRecord match) {
        if (match == null || match.matchDate() == null || match.homeTeamId() == null || match.awayTeamId() == null) {
            throw new ValidationException("Match incomplet pour le calcul des features");
        }
        PointInTimeStatsCache stats = snapshot.stats();
        EloRatingTracker elo = snapshot.elo();
        long home = match.homeTeamId();
        long away = match.awayTeamId();
        LocalDateTime asOf = match.matchDate();

        TeamForm homeForm = stats.form(home, asOf, properties.getFormWindow(), Venue.ALL, true);
        TeamForm awayForm = stats.form(away, asOf, properties.getFormWindow(), Venue.ALL, true);
        TeamForm homeAtHome = stats.form(home, asOf, properties.getFormWindow(), Venue.HOME, true);
        TeamForm awayAway = stats.form(away, asOf, properties.getFormWindow(), Venue.AWAY, true);
        TeamForm homeGoals = stats.form(home, asOf, properties.getGoalStatsWindow(), Venue.ALL, false);
        TeamForm awayGoals = stats.form(away, asOf, properties.getGoalStatsWindow(), Venue.ALL, false);
        TeamForm homeGoalsAtHome = stats.form(home, asOf, properties.getGoalStatsWindow(), Venue.HOME, false);
        TeamForm awayGoalsAway = stats.form(away, asOf, properties.getGoalStatsWindow(), Venue.AWAY, false);
        HeadToHead h2h = stats.headToHead(home, away, asOf, properties.getHeadToHeadWindow());

        double homeElo = elo.ratingAsOf(home, asOf);
        double awayElo = elo.ratingAsOf(away, asOf);

        return MatchFeatures.builder()
                .schemaVersion(snapshot.featureSchemaVersion())
                .matchId(match.id())
                .leagueId(match.leagueId())
                .matchDate(asOf.toString())
                .homeTeamId(home)
                .awayTeamId(away)
                .homeFormPoints(homeForm.points())
                .awayFormPoints(awayForm.points())
                .homeWeightedPoints(homeForm.weightedPoints())
                .awayWeightedPoints(awayForm.weightedPoints())
                .homeGoalsFor(homeForm.goalsFor())
                .homeGoalsAgainst(homeForm.goalsAgainst())
                .awayGoalsFor(awayForm.goalsFor())
                .awayGoalsAgainst(awayForm.goalsAgainst())
                .homeGoalDifference(homeForm.goalDifference())
                .awayGoalDifference(awayForm.goalDifference())
                .homeVenueWeightedPoints(homeAtHome.weightedPoints())
                .awayVenueWeightedPoints(awayAway.weightedPoints())
                .homePointsPerGame(homeGoals.pointsPerGame())
                .awayPointsPerGame(awayGoals.pointsPerGame())
                .homeAttack(homeGoals.avgGoalsFor())
                .homeDefense(homeGoals.avgGoalsAgainst())
                .awayAttack(awayGoals.avgGoalsFor())
                .awayDefense(awayGoals.avgGoalsAgainst())
                .homeAttackAtHome(homeGoalsAtHome.avgGoalsFor())
                .homeDefenseAtHome(homeGoalsAtHome.avgGoalsAgainst())
                .awayAttackAway(awayGoalsAway.avgGoalsFor())
                .awayDefenseAway(awayGoalsAway.avgGoalsAgainst())
                .homeCleanSheetRate(homeGoals.cleanSheetRate())
                .awayCleanSheetRate(awayGoals.cleanSheetRate())
                .homeBttsRate(homeGoals.bttsRate())
                .awayBttsRate(awayGoals.bttsRate())
                .homeOver25Rate(homeGoals.over25Rate())
                .awayOver25Rate(awayGoals.over25Rate())
                .homeFailedToScoreRate(homeGoals.failedToScoreRate())
                .awayFailedToScoreRate(awayGoals.failedToScoreRate())
                .h2hMatches(h2h.matches())
                .h2hHomeWins(h2h.teamAWins())
                .h2hDraws(h2h.draws())
                .h2hAwayWins(h2h.teamBWins())
                .h2hAvgTotalGoals(h2h.avgTeamAGoals() + h2h.avgTeamBGoals())
                .seasonProgress(seasonProgress(match, leagueSize(stats, home, match.leagueId())))
                .homePosition(position(stats, home, match.leagueId(), asOf))
                .awayPosition(position(stats, away, match.leagueId(), asOf))
                .homeRestDays(stats.restDays(home, asOf))
                .awayRestDays(stats.restDays(away, asOf))
                .homeStreak(stats.streak(home, asOf, properties.getFormWindow()))
                .awayStreak(stats.streak(away, asOf, properties.getFormWindow()))
                .homeElo(homeElo)
                .awayElo(awayElo)
                .eloDiff(homeElo - awayElo)
                .eloExpectedHome(elo.expectedScores(homeElo, awayElo).home())
                .result(match.hasScore() ? BetMarket.resultCode(match.homeGoals(), match.awayGoals()) : null)
                .homeGoals(match.homeGoals())
                .awayGoals(match.awayGoals())
                .build();
    }

    // Ligue inconnue du cache (aucune équipe, aucun match) : milieu de tableau par défaut
    private int position(PointInTimeStatsCache stats, long team, Long leagueId, LocalDateTime asOf) {
        Long league = leagueId != null ? leagueId : stats.leagueOf(team);
        if (league == null || !stats.isKnownLeague(league)) {
            return (properties.getDefaultLeagueSize() + 1) / 2;
        }
        return stats.leaguePosition(team, league, asOf);
    }

    private int leagueSize(PointInTimeStatsCache stats, long team, Long leagueId) {
        Long league = leagueId != null ? leagueId : stats.leagueOf(team);
        return league == null ? properties.getDefaultLeagueSize() : stats.leagueSize(league);
    }

    /**
     * Avancement de la saison dans [0, 1] : journée / (2 x (équipes - 1)) si la journée est connue,
     * sinon d'après le mois (août = 0, +0.1 par mois, 1 à partir de juin).
     */
    static double seasonProgress(MatchRecord match, int leagueSize) {
        if (match.round() != null && match.round() > 0) {
            int rounds = 2 * Math.max(1, leagueSize - 1);
            return Math.min(1.0, (double) match.round() / rounds);
        }
        int month = match.matchDate().getMonthValue();
        double progress = month >= 8 ? (month - 8) / 10.0 : (month + 4) / 10.0;
        return Math.min(1.0, progress);
    }

    /**
     * Jeu de données complet, calculé en parallèle (le snapshot est en lecture seule), trié par date.
     */
    public List<MatchFeatures> buildDataset(ModelSnapshot snapshot, Collection<MatchRecord> matches) {
        long start = System.currentTimeMillis();
        List<MatchFeatures> rows = matches.parallelStream()
                .sorted(MatchRecord.CHRONOLOGICAL)
                .map(m -> buildFeatures(snapshot, m))
                .toList();
        log.info("📊 Dataset de features : {} lignes ({} ms, {} fenêtres en cache)",
                rows.size(), System.currentTimeMillis() - start, snapshot.stats().cachedWindowCount());
        return rows;
    }
}
