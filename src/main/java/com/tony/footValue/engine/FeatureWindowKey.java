package com.tony.footValue.engine;

import java.time.LocalDateTime;

/**
 * Clé de mémoïsation d'une fenêtre de forme : le tuple exact des entrées.
 */
public record FeatureWindowKey(long teamId, Venue venue, LocalDateTime asOf, int window, boolean weighted) {
}
