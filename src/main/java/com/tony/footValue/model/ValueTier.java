package com.tony.footValue.model;

public enum ValueTier {
    HIGH, MEDIUM, NEUTRAL;

    public boolean isBettable() {
        return this == HIGH || this == MEDIUM;
    }
}
