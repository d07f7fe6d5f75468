package com.tony.footValue.controller;

import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.ValueTier;
import com.tony.footValue.model.dto.EquityPoint;
import com.tony.footValue.model.dto.PerformanceStats;
import com.tony.footValue.model.dto.PlaceBetRequest;
import com.tony.footValue.model.dto.SettlementReport;
import com.tony.footValue.service.BetLedgerService;
import com.tony.footValue.service.PerformanceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/bets")
@RequiredArgsConstructor
public class BetController {

    private final BetLedgerService betLedgerService;
    private final PerformanceService performanceService;

    @PostMapping
    public ResponseEntity<BetRecord> placeBet(@Valid @RequestBody PlaceBetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(betLedgerService.placeBet(request));
    }

    @PostMapping("/settle")
    public ResponseEntity<SettlementReport> settle() {
        return ResponseEntity.ok(betLedgerService.settlePendingBets());
    }

    @GetMapping("/stats")
    public ResponseEntity<PerformanceStats> getStats() {
        return ResponseEntity.ok(performanceService.getPerformanceStats());
    }

    @GetMapping("/equity-curve")
    public ResponseEntity<List<EquityPoint>> getEquityCurve(@RequestParam(required = false) Double initialBankroll) {
        return ResponseEntity.ok(performanceService.getEquityCurve(initialBankroll));
    }

    @GetMapping("/history")
    public ResponseEntity<List<BetRecord>> getHistory(
            @RequestParam(required = false) ValueTier valueTier,
            @RequestParam(required = false) BetStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(performanceService.getBetHistory(valueTier, status, limit));
    }
}
