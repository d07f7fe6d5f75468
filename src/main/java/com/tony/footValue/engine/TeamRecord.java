package com.tony.footValue.engine;

public record TeamRecord(Long id, Long leagueId, String name) {
}
