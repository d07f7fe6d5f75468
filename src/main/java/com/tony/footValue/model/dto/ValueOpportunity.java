package com.tony.footValue.model.dto;

import com.tony.footValue.model.ValueAnalysis;

public record ValueOpportunity(Long matchId, Long homeTeamId, Long awayTeamId, ValueAnalysis analysis) {
}
