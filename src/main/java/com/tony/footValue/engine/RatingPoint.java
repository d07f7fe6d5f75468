package com.tony.footValue.engine;

import java.time.LocalDateTime;

/** Valeur Elo d'une équipe juste après le match {@code matchId}. */
public record RatingPoint(LocalDateTime timestamp, double rating, Long matchId) {
}
