package com.tony.footValue.service;

import com.tony.footValue.config.PredictionProperties;
import com.tony.footValue.engine.DixonColesModel;
import com.tony.footValue.engine.EloRatingTracker;
import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.engine.PointInTimeStatsCache;
import com.tony.footValue.engine.TeamRecord;
import com.tony.footValue.exception.ModelNotReadyException;
import com.tony.footValue.repository.MatchHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Détient le snapshot courant des modèles. La reconstruction est toujours explicite :
 * un appelant qui tient une référence garde la même vue jusqu'au bout de son calcul.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelSnapshotService {

    private final MatchHistoryStore historyStore;
    private final EloRatingService eloRatingService;
    private final PredictionProperties properties;

    private final AtomicReference<ModelSnapshot> current = new AtomicReference<>();

    /**
     * Construit un snapshot sans le publier.
     * @param cutoff borne exclusive de l'historique chargé, {@code null} = tout
     */
    public ModelSnapshot build(LocalDateTime cutoff) {
        long start = System.currentTimeMillis();

        // 1. Chargement unique de l'historique et des équipes
        List<MatchRecord> history = historyStore.listFinishedMatches(cutoff, null);
        List<TeamRecord> teams = new ArrayList<>();
        for (Long leagueId : historyStore.listLeagueIds()) {
            teams.addAll(historyStore.listTeams(leagueId));
        }

        // 2. Construction des modèles sur la même vue
        PointInTimeStatsCache stats = PointInTimeStatsCache.build(history, teams, properties.toStatsParameters());
        EloRatingTracker elo = eloRatingService.replay(history);
        DixonColesModel scoreline = DixonColesModel.fit(history, properties.toScorelineParameters());

        ModelSnapshot snapshot = new ModelSnapshot(LocalDateTime.now(), cutoff, properties.getFeatureSchemaVersion(),
                history.size(), stats, elo, scoreline);

        log.info("🧠 Snapshot construit : {} matchs, {} équipes notées Elo, {} forces Dixon-Coles ({} ms)",
                history.size(), elo.trackedTeams(), scoreline.ratedTeams(), System.currentTimeMillis() - start);
        return snapshot;
    }

    /** Reconstruit sur tout l'historique et publie le résultat. */
    public ModelSnapshot rebuild() {
        ModelSnapshot snapshot = build(null);
        current.set(snapshot);
        return snapshot;
    }

    public Optional<ModelSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public ModelSnapshot requireCurrent() {
        ModelSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new ModelNotReadyException();
        }
        return snapshot;
    }
}
