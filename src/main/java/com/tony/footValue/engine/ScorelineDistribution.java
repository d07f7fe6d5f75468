package com.tony.footValue.engine;

import com.tony.footValue.model.BetMarket;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Matrice des probabilités jointes (buts domicile, buts extérieur), chacun borné par {@code maxGoals}.
 * Entrées positives, somme égale à 1 après normalisation.
 */
public final class ScorelineDistribution {

    private final double[][] matrix;
    private final double lambdaHome;
    private final double lambdaAway;
    private final double rho;

    ScorelineDistribution(double[][] matrix, double lambdaHome, double lambdaAway, double rho) {
        this.matrix = matrix;
        this.lambdaHome = lambdaHome;
        this.lambdaAway = lambdaAway;
        this.rho = rho;
    }

    public double probability(int homeGoals, int awayGoals) {
        if (homeGoals < 0 || awayGoals < 0 || homeGoals > maxGoals() || awayGoals > maxGoals()) {
            return 0.0;
        }
        return matrix[homeGoals][awayGoals];
    }

    /** Somme des cellules dont le score satisfait le prédicat. */
    public double sum(BetMarket.ScorePredicate predicate) {
        double total = 0.0;
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                if (predicate.test(i, j)) {
                    total += matrix[i][j];
                }
            }
        }
        return total;
    }

    public double probability(BetMarket market) {
        return sum(market.outcome());
    }

    public double total() {
        return sum((h, a) -> true);
    }

    public ScoreProbability mostLikely() {
        return top(1).get(0);
    }

    /** Les {@code n} scores les plus probables, du plus au moins probable. */
    public List<ScoreProbability> top(int n) {
        List<ScoreProbability> cells = new ArrayList<>();
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                cells.add(new ScoreProbability(i, j, matrix[i][j]));
            }
        }
        cells.sort(Comparator.comparingDouble(ScoreProbability::probability).reversed());
        return List.copyOf(cells.subList(0, Math.min(Math.max(n, 0), cells.size())));
    }

    public int maxGoals() {
        return matrix.length - 1;
    }

    public double lambdaHome() {
        return lambdaHome;
    }

    public double lambdaAway() {
        return lambdaAway;
    }

    public double rho() {
        return rho;
    }
}
