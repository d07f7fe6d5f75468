package com.tony.footValue.engine;

import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Toutes les probabilités de marché d'un match, lues sur une seule et même matrice corrélée.
 */
public record MatchPrediction(long homeTeamId,
                              long awayTeamId,
                              ExpectedGoals expectedGoals,
                              double rho,
                              Map<BetMarket, Double> markets,
                              ScoreProbability mostLikelyScore,
                              List<ScoreProbability> topScores) {

    public record OverUnder(double over, double under) {}

    public MatchPrediction {
        markets = Collections.unmodifiableMap(new EnumMap<>(markets));
        topScores = List.copyOf(topScores);
    }

    public static MatchPrediction from(long homeTeamId, long awayTeamId, ScorelineDistribution distribution) {
        Map<BetMarket, Double> markets = new EnumMap<>(BetMarket.class);
        for (BetMarket market : BetMarket.values()) {
            markets.put(market, distribution.probability(market));
        }
        return new MatchPrediction(homeTeamId, awayTeamId,
                new ExpectedGoals(distribution.lambdaHome(), distribution.lambdaAway()),
                distribution.rho(), markets, distribution.mostLikely(), distribution.top(5));
    }

    public double probability(BetMarket market) {
        return markets.get(market);
    }

    public double homeWin() {
        return probability(BetMarket.HOME_WIN);
    }

    public double draw() {
        return probability(BetMarket.DRAW);
    }

    public double awayWin() {
        return probability(BetMarket.AWAY_WIN);
    }

    public double btts() {
        return probability(BetMarket.BTTS_YES);
    }

    /** Clés "1X", "12", "X2". */
    public Map<String, Double> doubleChance() {
        return byCategory(BetMarket.Category.DOUBLE_CHANCE);
    }

    /** Combinés indexés par nom de marché ("1_over_25", "gg_over_25"...). */
    public Map<String, Double> combos() {
        return byCategory(BetMarket.Category.COMBO);
    }

    public OverUnder overUnder(double threshold) {
        if (threshold == 1.5) return new OverUnder(probability(BetMarket.OVER_15), probability(BetMarket.UNDER_15));
        if (threshold == 2.5) return new OverUnder(probability(BetMarket.OVER_25), probability(BetMarket.UNDER_25));
        if (threshold == 3.5) return new OverUnder(probability(BetMarket.OVER_35), probability(BetMarket.UNDER_35));
        throw new ValidationException("Seuil over/under non géré : " + threshold);
    }

    private Map<String, Double> byCategory(BetMarket.Category category) {
        Map<String, Double> result = new LinkedHashMap<>();
        markets.forEach((market, p) -> {
            if (market.getCategory() == category) {
                result.put(market.getCode(), p);
            }
        });
        return result;
    }
}
