package com.tony.footValue.model.dto;

public record SettlementReport(int candidates, int settled, int won, int lost, int conflicts, int skipped) {
}
