package com.tony.footValue.engine;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Elo courant d'une équipe et son historique chronologique (append-only).
 */
public record RatingState(long teamId, double current, List<RatingPoint> history) {

    public RatingState {
        history = List.copyOf(history);
    }

    /** Dernière valeur enregistrée strictement avant {@code date}, sinon {@code initial}. */
    public double valueAsOf(LocalDateTime date, double initial) {
        int low = 0;
        int high = history.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (history.get(mid).timestamp().isBefore(date)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low == 0 ? initial : history.get(low - 1).rating();
    }
}
