package com.tony.footValue.engine;

public record EloPrediction(double homeRating, double awayRating, double homeWin, double draw, double awayWin) {
}
