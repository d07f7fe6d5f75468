package com.tony.footValue.model.dto;

import java.time.LocalDateTime;

public record EquityPoint(LocalDateTime timestamp, double bankroll, double cumulativePnl, int betCount) {
}
