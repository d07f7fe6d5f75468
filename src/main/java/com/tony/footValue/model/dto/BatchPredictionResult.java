package com.tony.footValue.model.dto;

import java.util.List;

/**
 * Résultat d'un batch : les matchs en échec sont listés, pas propagés.
 */
public record BatchPredictionResult(List<FixturePrediction> predictions, List<SkippedFixture> skipped) {

    public BatchPredictionResult {
        predictions = List.copyOf(predictions);
        skipped = List.copyOf(skipped);
    }
}
