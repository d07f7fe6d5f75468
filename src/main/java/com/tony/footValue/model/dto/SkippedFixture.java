package com.tony.footValue.model.dto;

public record SkippedFixture(Long matchId, String reason) {
}
