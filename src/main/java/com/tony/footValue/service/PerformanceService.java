package com.tony.footValue.service;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.ValueTier;
import com.tony.footValue.model.dto.EquityPoint;
import com.tony.footValue.model.dto.PerformanceStats;
import com.tony.footValue.model.dto.TierPerformance;
import com.tony.footValue.repository.BetRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rapports de performance sur les paris réglés : ROI, taux de réussite, courbe de bankroll.
 */
@Service
@RequiredArgsConstructor
public class PerformanceService {

    private static final List<BetStatus> SETTLED = List.of(BetStatus.WON, BetStatus.LOST);

    private final BetRecordRepository betRepository;
    private final BettingProperties properties;

    public PerformanceStats getPerformanceStats() {
        List<BetRecord> settled = betRepository.findByStatusIn(SETTLED);
        long pending = betRepository.countByStatus(BetStatus.PENDING);

        if (settled.isEmpty()) {
            return PerformanceStats.builder()
                    .pendingBets(pending)
                    .byValueTier(emptyTiers())
                    .build();
        }

        int won = 0;
        double staked = 0.0, pnl = 0.0, prices = 0.0;
        double bestWin = 0.0, worstLoss = 0.0;
        for (BetRecord bet : settled) {
            double betPnl = bet.getPnl() == null ? 0.0 : bet.getPnl();
            if (bet.getStatus() == BetStatus.WON) won++;
            staked += bet.getStakeAmount();
            pnl += betPnl;
            prices += bet.getPrice();
            bestWin = Math.max(bestWin, betPnl);
            worstLoss = Math.min(worstLoss, betPnl);
        }

        int total = settled.size();
        return PerformanceStats.builder()
                .totalBets(total)
                .pendingBets(pending)
                .wonBets(won)
                .lostBets(total - won)
                .totalStaked(round(staked))
                .totalPnl(round(pnl))
                .roiPercent(staked > 0 ? round(pnl / staked * 100.0) : 0.0)
                .winRate(round((double) won / total * 100.0))
                .avgPrice(round(prices / total))
                .avgStake(round(staked / total))
                .bestWin(round(bestWin))
                .worstLoss(round(worstLoss))
                .byValueTier(byTier(settled))
                .build();
    }

    private Map<ValueTier, TierPerformance> byTier(List<BetRecord> settled) {
        Map<ValueTier, TierPerformance> result = new EnumMap<>(ValueTier.class);
        for (ValueTier tier : ValueTier.values()) {
            int bets = 0, won = 0;
            double pnl = 0.0;
            for (BetRecord bet : settled) {
                if (bet.getValueTier() != tier) continue;
                bets++;
                if (bet.getStatus() == BetStatus.WON) won++;
                pnl += bet.getPnl() == null ? 0.0 : bet.getPnl();
            }
            result.put(tier, new TierPerformance(bets, won, bets == 0 ? 0.0 : round((double) won / bets * 100.0), round(pnl)));
        }
        return result;
    }

    private Map<ValueTier, TierPerformance> emptyTiers() {
        Map<ValueTier, TierPerformance> result = new EnumMap<>(ValueTier.class);
        for (ValueTier tier : ValueTier.values()) {
            result.put(tier, new TierPerformance(0, 0, 0.0, 0.0));
        }
        return result;
    }

    /**
     * Courbe de bankroll : point de départ puis un point par pari réglé, dans l'ordre de règlement.
     * @param initialBankroll bankroll de départ, {@code null} = valeur configurée
     */
    public List<EquityPoint> getEquityCurve(Double initialBankroll) {
        double initial = initialBankroll == null ? properties.getInitialBankroll() : initialBankroll;
        if (Double.isNaN(initial) || initial <= 0.0) {
            throw new ValidationException("Bankroll initiale invalide : " + initial);
        }

        List<BetRecord> settled = betRepository.findByStatusInAndSettledAtIsNotNullOrderBySettledAtAscIdAsc(SETTLED);
        List<EquityPoint> curve = new ArrayList<>();
        if (settled.isEmpty()) {
            curve.add(new EquityPoint(LocalDateTime.now(), initial, 0.0, 0));
            return curve;
        }

        curve.add(new EquityPoint(settled.get(0).getPlacedAt(), initial, 0.0, 0));
        double cumulative = 0.0;
        int count = 0;
        for (BetRecord bet : settled) {
            cumulative += bet.getPnl() == null ? 0.0 : bet.getPnl();
            count++;
            curve.add(new EquityPoint(bet.getSettledAt(), round(initial + cumulative), round(cumulative), count));
        }
        return curve;
    }

    /** Historique filtrable, du plus récent au plus ancien. */
    public List<BetRecord> getBetHistory(ValueTier tier, BetStatus status, int limit) {
        if (limit <= 0) {
            throw new ValidationException("La limite doit être positive : " + limit);
        }
        return betRepository.findHistory(tier, status, PageRequest.of(0, limit));
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
