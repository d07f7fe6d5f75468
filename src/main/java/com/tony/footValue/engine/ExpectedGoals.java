package com.tony.footValue.engine;

public record ExpectedGoals(double home, double away) {
}
