package com.tony.footValue.model.dto;

import com.tony.footValue.engine.EloPrediction;
import com.tony.footValue.engine.MatchPrediction;
import com.tony.footValue.engine.MatchRecord;

public record FixturePrediction(MatchRecord fixture, MatchPrediction markets, EloPrediction elo) {
}
