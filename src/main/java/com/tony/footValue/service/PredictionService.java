package com.tony.footValue.service;

import com.tony.footValue.engine.EloPrediction;
import com.tony.footValue.engine.MatchPrediction;
import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.exception.UnknownEntityException;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.dto.BatchPredictionResult;
import com.tony.footValue.model.dto.FixturePrediction;
import com.tony.footValue.model.dto.SkippedFixture;
import com.tony.footValue.repository.MatchHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final ModelSnapshotService snapshotService;
    private final MatchHistoryStore historyStore;

    private record Outcome(FixturePrediction prediction, SkippedFixture skipped) {}

    /**
     * Prédiction d'un match sur un snapshot donné : marchés Dixon-Coles et 1X2 Elo d'avant-match.
     */
    public FixturePrediction predict(ModelSnapshot snapshot, MatchRecord fixture) {
        if (fixture == null || fixture.homeTeamId() == null || fixture.awayTeamId() == null) {
            throw new ValidationException("Match incomplet : équipes requises");
        }
        if (fixture.matchDate() == null) {
            throw new ValidationException("Match " + fixture.id() + " sans date");
        }
        // Une équipe absente de l'historique serait cotée avec des forces neutres
        requireKnownTeam(snapshot, fixture.homeTeamId());
        requireKnownTeam(snapshot, fixture.awayTeamId());
        MatchPrediction markets = snapshot.scoreline().predict(fixture.homeTeamId(), fixture.awayTeamId());
        EloPrediction elo = snapshot.elo().predict(fixture.homeTeamId(), fixture.awayTeamId(), fixture.matchDate());
        return new FixturePrediction(fixture, markets, elo);
    }

    private static void requireKnownTeam(ModelSnapshot snapshot, long teamId) {
        if (!snapshot.stats().isKnownTeam(teamId)) {
            throw new UnknownEntityException("Équipe", teamId);
        }
    }

    /**
     * Prédit tous les matchs en parallèle. Un match en échec (validation ou normalisation)
     * est écarté et rapporté, le batch continue.
     */
    public BatchPredictionResult predictAll(ModelSnapshot snapshot, Collection<MatchRecord> fixtures) {
        List<Outcome> outcomes = fixtures.parallelStream()
                .map(fixture -> predictSafely(snapshot, fixture))
                .toList();

        List<FixturePrediction> predictions = new ArrayList<>();
        List<SkippedFixture> skipped = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.prediction() != null) predictions.add(outcome.prediction());
            else skipped.add(outcome.skipped());
        }

        log.info("🔮 Batch de prédictions : {} calculées, {} écartées", predictions.size(), skipped.size());
        return new BatchPredictionResult(predictions, skipped);
    }

    private Outcome predictSafely(ModelSnapshot snapshot, MatchRecord fixture) {
        try {
            return new Outcome(predict(snapshot, fixture), null);
        } catch (IllegalArgumentException | ArithmeticException e) {
            Long id = fixture == null ? null : fixture.id();
            log.warn("⚠️ Match {} écarté : {}", id, e.getMessage());
            return new Outcome(null, new SkippedFixture(id, e.getMessage()));
        }
    }

    /** Matchs programmés des {@code days} prochains jours, sur le snapshot courant. */
    public BatchPredictionResult predictUpcoming(int days) {
        if (days <= 0) {
            throw new ValidationException("Le nombre de jours doit être positif : " + days);
        }
        ModelSnapshot snapshot = snapshotService.requireCurrent();
        LocalDateTime now = LocalDateTime.now();
        return predictAll(snapshot, historyStore.listUpcomingMatches(now, now.plusDays(days)));
    }

    public FixturePrediction predictMatch(Long matchId) {
        MatchRecord fixture = historyStore.findMatch(matchId)
                .orElseThrow(() -> new UnknownEntityException("Match", matchId));
        return predict(snapshotService.requireCurrent(), fixture);
    }
}
