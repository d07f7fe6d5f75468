package com.tony.footValue.model.dto;

import com.tony.footValue.model.ValueTier;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class PerformanceStats {
    private int totalBets;      // paris réglés
    private long pendingBets;
    private int wonBets;
    private int lostBets;
    private double totalStaked;
    private double totalPnl;
    private double roiPercent;
    private double winRate;     // en %
    private double avgPrice;
    private double avgStake;
    private double bestWin;
    private double worstLoss;
    private Map<ValueTier, TierPerformance> byValueTier;
}
