package com.tony.footValue.service;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.engine.MatchPrediction;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.RiskTier;
import com.tony.footValue.model.ValueAnalysis;
import com.tony.footValue.model.ValueTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Moteur de décision (critère de Kelly). Sans état : sûr en appel concurrent.
 * Les entrées invalides sont rejetées, jamais bornées en silence.
 */
@Service
@RequiredArgsConstructor
public class ValueBettingService {

    private static final List<BetMarket> CORE_MARKETS = List.of(
            BetMarket.HOME_WIN, BetMarket.DRAW, BetMarket.AWAY_WIN,
            BetMarket.OVER_25, BetMarket.BTTS_YES,
            BetMarket.HOME_OR_DRAW, BetMarket.HOME_OR_AWAY, BetMarket.DRAW_OR_AWAY);

    // Seuils du niveau de risque (fraction Kelly bornée)
    private static final double LOW_RISK_LIMIT = 0.05;
    private static final double MEDIUM_RISK_LIMIT = 0.15;

    private final BettingProperties properties;

    /**
     * Analyse brute d'une probabilité contre une cote.
     * @throws ValidationException si p hors [0,1], cote &lt; 1 ou plafond hors [0,1]
     */
    public ValueAnalysis analyze(double probability, double price, double maxKellyFraction) {
        return analyze(null, probability, price, false, maxKellyFraction);
    }

    public ValueAnalysis analyze(BetMarket market, double probability, double price) {
        return analyze(market, probability, price, false, properties.getMaxKellyFraction());
    }

    /**
     * Analyse avec cote réelle si fournie, sinon cote estimée (et marquée comme telle).
     */
    public ValueAnalysis analyzeWithEstimate(BetMarket market, double probability, OptionalDouble price) {
        if (price.isPresent()) {
            return analyze(market, probability, price.getAsDouble(), false, properties.getMaxKellyFraction());
        }
        double estimated = estimateBookmakerPrice(probability, properties.getBookmakerMargin());
        return analyze(market, probability, estimated, true, properties.getMaxKellyFraction());
    }

    /**
     * Cote qu'afficherait un bookmaker avec la marge donnée : 1 / (p x (1 - marge)), arrondie au centième.
     */
    public double estimateBookmakerPrice(double probability, double margin) {
        if (Double.isNaN(probability) || probability <= 0.0 || probability > 1.0) {
            throw new ValidationException("Probabilité hors ]0,1] : " + probability);
        }
        if (Double.isNaN(margin) || margin < 0.0 || margin >= 1.0) {
            throw new ValidationException("Marge hors [0,1[ : " + margin);
        }
        double price = 1.0 / (probability * (1.0 - margin));
        return Math.max(1.0, round2(price));
    }

    /**
     * Analyse tous les marchés principaux d'une prédiction, plus les combinés assez probables.
     * Cotes absentes de {@code prices} : estimées.
     */
    public List<ValueAnalysis> analyzeMarkets(MatchPrediction prediction, Map<BetMarket, Double> prices) {
        List<BetMarket> markets = new ArrayList<>(CORE_MARKETS);
        prediction.markets().forEach((market, p) -> {
            if (market.getCategory() == BetMarket.Category.COMBO && p > properties.getComboMinProbability()) {
                markets.add(market);
            }
        });

        List<ValueAnalysis> analyses = new ArrayList<>();
        for (BetMarket market : markets) {
            double p = prediction.probability(market);
            if (p <= 0.0) continue;
            Double price = prices == null ? null : prices.get(market);
            analyses.add(analyzeWithEstimate(market, p, price == null ? OptionalDouble.empty() : OptionalDouble.of(price)));
        }
        return analyses;
    }

    // =================================================================================
    // CALCULS
    // =================================================================================

    private ValueAnalysis analyze(BetMarket market, double p, double price, boolean estimated, double maxKelly) {
        validate(p, price, maxKelly);

        double raw = rawKelly(p, price);
        double capped = Math.max(0.0, Math.min(maxKelly, raw));
        double ev = p * price;
        double edge = (ev - 1.0) * 100.0;

        ValueTier tier = valueTier(ev);
        RiskTier risk = riskTier(capped);
        boolean shouldBet = raw > 0.0 && tier.isBettable() && capped >= properties.getMinKellyFraction();

        return new ValueAnalysis(market, p, price, estimated, 1.0 / price, raw, capped, ev, edge,
                tier, risk, shouldBet, recommendation(tier, shouldBet, capped));
    }

    /**
     * f* = (b.p - (1 - p)) / b avec b = cote - 1, écrit (p x cote - 1) / b.
     * Cote à 1.0 (b = 0) : f* = 0.
     */
    static double rawKelly(double p, double price) {
        double b = price - 1.0;
        if (b == 0.0) {
            return 0.0;
        }
        return (p * price - 1.0) / b;
    }

    ValueTier valueTier(double expectedValue) {
        if (expectedValue >= properties.getHighValueEv()) return ValueTier.HIGH;
        if (expectedValue >= properties.getMediumValueEv()) return ValueTier.MEDIUM;
        return ValueTier.NEUTRAL;
    }

    static RiskTier riskTier(double cappedFraction) {
        if (cappedFraction <= 0.0) return RiskTier.NONE;
        if (cappedFraction < LOW_RISK_LIMIT) return RiskTier.LOW;
        if (cappedFraction < MEDIUM_RISK_LIMIT) return RiskTier.MEDIUM;
        return RiskTier.HIGH;
    }

    private String recommendation(ValueTier tier, boolean shouldBet, double capped) {
        if (!shouldBet) {
            return "⛔ Pas de value exploitable";
        }
        String stake = String.format("%.1f%% de la bankroll", capped * 100.0);
        return tier == ValueTier.HIGH ? "🔥 Forte value : miser " + stake : "✅ Value : miser " + stake;
    }

    private static void validate(double p, double price, double maxKelly) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new ValidationException("Probabilité hors [0,1] : " + p);
        }
        if (Double.isNaN(price) || Double.isInfinite(price) || price < 1.0) {
            throw new ValidationException("Cote invalide (doit être >= 1.0) : " + price);
        }
        if (Double.isNaN(maxKelly) || maxKelly < 0.0 || maxKelly > 1.0) {
            throw new ValidationException("Plafond Kelly hors [0,1] : " + maxKelly);
        }
    }

    private double round2(double val) { return Math.round(val * 100.0) / 100.0; }
}
