package com.tony.footValue.engine;

/** Scores attendus Elo ; {@code away} vaut exactement {@code 1 - home}. */
public record ExpectedScores(double home, double away) {
}
