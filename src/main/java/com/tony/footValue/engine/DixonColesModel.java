package com.tony.footValue.engine;

import com.tony.footValue.exception.ScorelineNormalizationException;
import com.tony.footValue.exception.ValidationException;
import org.apache.commons.math3.distribution.PoissonDistribution;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Modèle de Poisson corrélé (correction Dixon-Coles sur les petits scores).
 * <ol>
 *     <li>forces attaque/défense relatives aux moyennes de la ligue, calculées une fois sur l'historique</li>
 *     <li>buts attendus bornés, avantage domicile additif</li>
 *     <li>matrice Poisson x Poisson, facteur tau sur les cellules i &lt;= 1 et j &lt;= 1, renormalisée</li>
 * </ol>
 * Tous les marchés, combinés compris, sont ensuite sommés sur cette même matrice.
 */
public final class DixonColesModel {

    private final ScorelineParameters params;
    private final double leagueAvgHome;
    private final double leagueAvgAway;
    private final Map<Long, TeamStrength> strengths;

    private DixonColesModel(ScorelineParameters params, double leagueAvgHome, double leagueAvgAway,
                            Map<Long, TeamStrength> strengths) {
        this.params = params;
        this.leagueAvgHome = leagueAvgHome;
        this.leagueAvgAway = leagueAvgAway;
        this.strengths = strengths;
    }

    /**
     * Calcule les forces de chaque équipe. Historique vide : moyennes par défaut, forces neutres.
     */
    public static DixonColesModel fit(Collection<MatchRecord> history, ScorelineParameters params) {
        Map<Long, int[]> home = new HashMap<>(); // [matchs, marqués, encaissés]
        Map<Long, int[]> away = new HashMap<>();
        long totalHomeGoals = 0;
        long totalAwayGoals = 0;
        int played = 0;

        for (MatchRecord m : history) {
            if (!m.isFinished()) continue;
            played++;
            totalHomeGoals += m.homeGoals();
            totalAwayGoals += m.awayGoals();

            int[] h = home.computeIfAbsent(m.homeTeamId(), id -> new int[3]);
            h[0]++;
            h[1] += m.homeGoals();
            h[2] += m.awayGoals();

            int[] a = away.computeIfAbsent(m.awayTeamId(), id -> new int[3]);
            a[0]++;
            a[1] += m.awayGoals();
            a[2] += m.homeGoals();
        }

        double avgHome = params.defaultLeagueAvgHome();
        double avgAway = params.defaultLeagueAvgAway();
        if (played > 0) {
            // Une ligue sans aucun but ne doit pas produire de division par zéro
            if (totalHomeGoals > 0) avgHome = (double) totalHomeGoals / played;
            if (totalAwayGoals > 0) avgAway = (double) totalAwayGoals / played;
        }

        Map<Long, TeamStrength> strengths = new HashMap<>();
        for (Long team : union(home.keySet(), away.keySet())) {
            int[] h = home.get(team);
            int[] a = away.get(team);
            double attack = average(
                    h == null ? null : (double) h[1] / h[0] / avgHome,
                    a == null ? null : (double) a[1] / a[0] / avgAway);
            double defense = average(
                    h == null ? null : (double) h[2] / h[0] / avgAway,
                    a == null ? null : (double) a[2] / a[0] / avgHome);
            strengths.put(team, new TeamStrength(attack, defense));
        }

        return new DixonColesModel(params, avgHome, avgAway, Collections.unmodifiableMap(strengths));
    }

    private static Set<Long> union(Set<Long> a, Set<Long> b) {
        Set<Long> all = new HashSet<>(a);
        all.addAll(b);
        return all;
    }

    // Moyenne sur les lieux où l'équipe a joué
    private static double average(Double homeValue, Double awayValue) {
        if (homeValue == null && awayValue == null) return 1.0;
        if (homeValue == null) return awayValue;
        if (awayValue == null) return homeValue;
        return (homeValue + awayValue) / 2.0;
    }

    public TeamStrength strength(long teamId) {
        requireTeamId(teamId);
        return strengths.getOrDefault(teamId, TeamStrength.NEUTRAL);
    }

    /**
     * lambda_dom = att_dom x def_ext x moy_dom + avantage ; lambda_ext = att_ext x def_dom x moy_ext, bornés.
     */
    public ExpectedGoals expectedGoals(long homeTeamId, long awayTeamId) {
        if (homeTeamId == awayTeamId) {
            throw new ValidationException("Une équipe ne peut pas se rencontrer elle-même : " + homeTeamId);
        }
        TeamStrength home = strength(homeTeamId);
        TeamStrength away = strength(awayTeamId);

        double lambdaHome = home.attack() * away.defense() * leagueAvgHome + params.homeAdvantageGoals();
        double lambdaAway = away.attack() * home.defense() * leagueAvgAway;

        return new ExpectedGoals(
                clamp(lambdaHome, params.minHomeLambda(), params.maxHomeLambda()),
                clamp(lambdaAway, params.minAwayLambda(), params.maxAwayLambda()));
    }

    public ScorelineDistribution scoreline(long homeTeamId, long awayTeamId) {
        ExpectedGoals xg = expectedGoals(homeTeamId, awayTeamId);
        return buildMatrix(xg.home(), xg.away(), params.rho(), params.maxGoals());
    }

    public MatchPrediction predict(long homeTeamId, long awayTeamId) {
        return MatchPrediction.from(homeTeamId, awayTeamId, scoreline(homeTeamId, awayTeamId));
    }

    /**
     * Facteur de correction : 1 - lambda_dom x lambda_ext x rho pour les scores 0-0, 1-0, 0-1, 1-1, 1 sinon.
     */
    public static double tau(int homeGoals, int awayGoals, double lambdaHome, double lambdaAway, double rho) {
        if (homeGoals <= 1 && awayGoals <= 1) {
            return 1.0 - lambdaHome * lambdaAway * rho;
        }
        return 1.0;
    }

    /**
     * Matrice corrigée et renormalisée.
     * @throws ScorelineNormalizationException si la masse totale n'est pas un réel strictement positif
     */
    public static ScorelineDistribution buildMatrix(double lambdaHome, double lambdaAway, double rho, int maxGoals) {
        if (!(lambdaHome > 0) || !(lambdaAway > 0) || Double.isInfinite(lambdaHome) || Double.isInfinite(lambdaAway)) {
            throw new ScorelineNormalizationException("Buts attendus invalides : " + lambdaHome + " / " + lambdaAway);
        }
        double[] homePmf = poissonPmf(lambdaHome, maxGoals);
        double[] awayPmf = poissonPmf(lambdaAway, maxGoals);

        double[][] matrix = new double[maxGoals + 1][maxGoals + 1];
        double total = 0.0;
        for (int i = 0; i <= maxGoals; i++) {
            for (int j = 0; j <= maxGoals; j++) {
                double p = homePmf[i] * awayPmf[j] * tau(i, j, lambdaHome, lambdaAway, rho);
                matrix[i][j] = Math.max(0.0, p);
                total += matrix[i][j];
            }
        }

        if (!Double.isFinite(total) || total <= 0.0) {
            throw new ScorelineNormalizationException("Masse de probabilité non normalisable : " + total);
        }
        for (double[] row : matrix) {
            for (int j = 0; j < row.length; j++) {
                row[j] /= total;
            }
        }
        return new ScorelineDistribution(matrix, lambdaHome, lambdaAway, rho);
    }

    /** Probabilités de Poisson indépendantes, sans correction. */
    public static double[] poissonPmf(double lambda, int maxGoals) {
        PoissonDistribution poisson = new PoissonDistribution(null, lambda,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
        double[] pmf = new double[maxGoals + 1];
        for (int k = 0; k <= maxGoals; k++) {
            pmf[k] = poisson.probability(k);
        }
        return pmf;
    }

    public double leagueAvgHome() {
        return leagueAvgHome;
    }

    public double leagueAvgAway() {
        return leagueAvgAway;
    }

    public int ratedTeams() {
        return strengths.size();
    }

    public ScorelineParameters parameters() {
        return params;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static void requireTeamId(long teamId) {
        if (teamId <= 0) {
            throw new ValidationException("Identifiant d'équipe invalide : " + teamId);
        }
    }
}
