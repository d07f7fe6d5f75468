package com.tony.footValue.service;

import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.ValueAnalysis;
import com.tony.footValue.model.dto.BatchPredictionResult;
import com.tony.footValue.model.dto.FixturePrediction;
import com.tony.footValue.model.dto.ValueOpportunity;
import com.tony.footValue.repository.MatchHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Scanne les matchs à venir et remonte les paris recommandés, meilleure EV en tête.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValueScanService {

    private final PredictionService predictionService;
    private final ValueBettingService valueBettingService;
    private final ModelSnapshotService snapshotService;
    private final MatchHistoryStore historyStore;

    /**
     * @param prices           cotes réelles par match puis par marché (peut être vide)
     * @param includeEstimated garder les opportunités calculées sur une cote estimée
     */
    public List<ValueOpportunity> scan(ModelSnapshot snapshot,
                                       Collection<MatchRecord> fixtures,
                                       Map<Long, Map<BetMarket, Double>> prices,
                                       boolean includeEstimated) {
        BatchPredictionResult batch = predictionService.predictAll(snapshot, fixtures);

        List<ValueOpportunity> opportunities = new ArrayList<>();
        for (FixturePrediction prediction : batch.predictions()) {
            MatchRecord fixture = prediction.fixture();
            Map<BetMarket, Double> fixturePrices = prices == null ? Map.of() : prices.getOrDefault(fixture.id(), Map.of());
            for (ValueAnalysis analysis : valueBettingService.analyzeMarkets(prediction.markets(), fixturePrices)) {
                if (analysis.shouldBet() && (includeEstimated || !analysis.estimatedPrice())) {
                    opportunities.add(new ValueOpportunity(fixture.id(), fixture.homeTeamId(), fixture.awayTeamId(), analysis));
                }
            }
        }

        opportunities.sort(Comparator.comparingDouble((ValueOpportunity o) -> o.analysis().expectedValue()).reversed());
        log.info("💎 Scan value : {} opportunités sur {} matchs", opportunities.size(), batch.predictions().size());
        return opportunities;
    }

    public List<ValueOpportunity> scanUpcoming(int days, boolean includeEstimated) {
        if (days <= 0) {
            throw new ValidationException("Le nombre de jours doit être positif : " + days);
        }
        LocalDateTime now = LocalDateTime.now();
        return scan(snapshotService.requireCurrent(), historyStore.listUpcomingMatches(now, now.plusDays(days)),
                Map.of(), includeEstimated);
    }
}
