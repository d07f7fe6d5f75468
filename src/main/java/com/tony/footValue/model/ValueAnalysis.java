package com.tony.footValue.model;

/**
 * Analyse de value d'un marché : calculée une fois, jamais modifiée.
 *
 * @param market              marché analysé ({@code null} pour une analyse brute proba / cote)
 * @param estimatedPrice      vrai si la cote a été estimée faute de cote réelle
 * @param rawKellyFraction    f* non borné, négatif quand le pari est perdant en espérance
 * @param cappedKellyFraction f* borné à [0, plafond]
 */
public record ValueAnalysis(BetMarket market,
                            double probability,
                            double price,
                            boolean estimatedPrice,
                            double impliedProbability,
                            double rawKellyFraction,
                            double cappedKellyFraction,
                            double expectedValue,
                            double edgePercentage,
                            ValueTier valueTier,
                            RiskTier riskTier,
                            boolean shouldBet,
                            String recommendation) {

    public double kellyPercent() {
        return cappedKellyFraction * 100.0;
    }
}
