package com.tony.footValue.controller;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.ValueAnalysis;
import com.tony.footValue.model.dto.BatchPredictionResult;
import com.tony.footValue.model.dto.FixturePrediction;
import com.tony.footValue.model.dto.ValueAnalysisRequest;
import com.tony.footValue.model.dto.ValueOpportunity;
import com.tony.footValue.service.PredictionService;
import com.tony.footValue.service.ValueBettingService;
import com.tony.footValue.service.ValueScanService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.OptionalDouble;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionService predictionService;
    private final ValueBettingService valueBettingService;
    private final ValueScanService valueScanService;
    private final BettingProperties bettingProperties;

    @GetMapping("/upcoming")
    public ResponseEntity<BatchPredictionResult> getUpcoming(@RequestParam(defaultValue = "3") int days) {
        return ResponseEntity.ok(predictionService.predictUpcoming(days));
    }

    @GetMapping("/matches/{matchId}")
    public ResponseEntity<FixturePrediction> getMatchPrediction(@PathVariable Long matchId) {
        return ResponseEntity.ok(predictionService.predictMatch(matchId));
    }

    @GetMapping("/value-scan")
    public ResponseEntity<List<ValueOpportunity>> scanValue(
            @RequestParam(defaultValue = "3") int days,
            @RequestParam(defaultValue = "false") boolean includeEstimated) {
        return ResponseEntity.ok(valueScanService.scanUpcoming(days, includeEstimated));
    }

    @PostMapping("/value-analysis")
    public ResponseEntity<ValueAnalysis> analyzeValue(@Valid @RequestBody ValueAnalysisRequest request) {
        if (request.getMarket() == null) {
            if (request.getPrice() == null) {
                throw new ValidationException("Une cote est requise pour une analyse sans marché");
            }
            double maxKelly = request.getMaxKellyFraction() == null
                    ? bettingProperties.getMaxKellyFraction() : request.getMaxKellyFraction();
            return ResponseEntity.ok(valueBettingService.analyze(request.getProbability(), request.getPrice(), maxKelly));
        }
        BetMarket market = BetMarket.fromCode(request.getMarket())
                .orElseThrow(() -> new ValidationException("Marché inconnu : " + request.getMarket()));
        OptionalDouble price = request.getPrice() == null ? OptionalDouble.empty() : OptionalDouble.of(request.getPrice());
        return ResponseEntity.ok(valueBettingService.analyzeWithEstimate(market, request.getProbability(), price));
    }
}
