package com.tony.footValue.engine;

public record EloParameters(double initialRating, double kFactor, double homeBonus) {

    public static EloParameters defaults() {
        return new EloParameters(1500.0, 32.0, 100.0);
    }
}
