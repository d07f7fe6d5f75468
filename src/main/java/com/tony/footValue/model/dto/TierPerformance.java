package com.tony.footValue.model.dto;

public record TierPerformance(int bets, int won, double winRate, double pnl) {
}
