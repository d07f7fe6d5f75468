package com.tony.footValue.engine;

import java.time.LocalDateTime;

/**
 * Vue figée de tous les modèles construits à partir d'un même chargement de l'historique.
 * Passée explicitement à chaque requête ou batch, jamais reconstruite implicitement.
 */
public record ModelSnapshot(LocalDateTime builtAt,
                            LocalDateTime historyCutoff,
                            String featureSchemaVersion,
                            int matchCount,
                            PointInTimeStatsCache stats,
                            EloRatingTracker elo,
                            DixonColesModel scoreline) {
}
