package com.tony.footValue.model;

/**
 * Confiance d'un pari placé, déduite du pourcentage Kelly retenu.
 */
public enum ConfidenceLevel {
    HIGH, MEDIUM, LOW;

    public static ConfidenceLevel fromKellyPercent(double kellyPercent) {
        if (kellyPercent >= 15.0) return HIGH;
        if (kellyPercent >= 8.0) return MEDIUM;
        return LOW;
    }
}
