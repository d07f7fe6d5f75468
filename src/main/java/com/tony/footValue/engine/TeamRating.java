package com.tony.footValue.engine;

public record TeamRating(long teamId, double rating, int matchesPlayed) {
}
