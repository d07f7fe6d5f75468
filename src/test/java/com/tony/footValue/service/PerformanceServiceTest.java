package com.tony.footValue.service;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.ValueTier;
import com.tony.footValue.model.dto.EquityPoint;
import com.tony.footValue.model.dto.PerformanceStats;
import com.tony.footValue.repository.BetRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PerformanceServiceTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2025, 2, 1, 12, 0);

    @Mock
    private BetRecordRepository betRepository;

    private PerformanceService performanceService;

    @BeforeEach
    void setUp() {
        performanceService = new PerformanceService(betRepository, new BettingProperties());
    }

    private BetRecord settledBet(long id, BetMarket market, int homeGoals, int awayGoals,
                                 double stake, double price, ValueTier tier, int day) {
        BetRecord bet = BetRecord.builder()
                .id(id)
                .market(market)
                .stakeAmount(stake)
                .bankrollAtBet(1000.0)
                .price(price)
                .valueTier(tier)
                .placedAt(DAY.plusDays(day))
                .build();
        bet.settle(homeGoals, awayGoals, DAY.plusDays(day).plusHours(10));
        return bet;
    }

    private List<BetRecord> threeBets() {
        return List.of(
                settledBet(1L, BetMarket.HOME_WIN, 2, 1, 100.0, 2.5, ValueTier.HIGH, 0),   // +150
                settledBet(2L, BetMarket.DRAW, 2, 1, 50.0, 2.0, ValueTier.MEDIUM, 1),      // -50
                settledBet(3L, BetMarket.OVER_25, 3, 0, 100.0, 1.8, ValueTier.MEDIUM, 2)); // +80
    }

    @Test
    @DisplayName("Statistiques globales : ROI = PnL / mises, taux de réussite, extrêmes")
    void statsAggregateSettledBets() {
        when(betRepository.findByStatusIn(anyCollection())).thenReturn(threeBets());
        when(betRepository.countByStatus(BetStatus.PENDING)).thenReturn(4L);

        PerformanceStats stats = performanceService.getPerformanceStats();

        assertThat(stats.getTotalBets()).isEqualTo(3);
        assertThat(stats.getPendingBets()).isEqualTo(4L);
        assertThat(stats.getWonBets()).isEqualTo(2);
        assertThat(stats.getLostBets()).isEqualTo(1);
        assertThat(stats.getTotalStaked()).isCloseTo(250.0, within(1e-9));
        assertThat(stats.getTotalPnl()).isCloseTo(180.0, within(1e-9));
        assertThat(stats.getRoiPercent()).isCloseTo(72.0, within(1e-9));
        assertThat(stats.getWinRate()).isCloseTo(66.67, within(1e-9));
        assertThat(stats.getAvgPrice()).isCloseTo(2.1, within(1e-9));
        assertThat(stats.getAvgStake()).isCloseTo(83.33, within(1e-9));
        assertThat(stats.getBestWin()).isCloseTo(150.0, within(1e-9));
        assertThat(stats.getWorstLoss()).isCloseTo(-50.0, within(1e-9));
    }

    @Test
    void statsAreBrokenDownByValueTier() {
        when(betRepository.findByStatusIn(anyCollection())).thenReturn(threeBets());
        when(betRepository.countByStatus(BetStatus.PENDING)).thenReturn(0L);

        PerformanceStats stats = performanceService.getPerformanceStats();

        assertThat(stats.getByValueTier()).containsKeys(ValueTier.values());
        assertThat(stats.getByValueTier().get(ValueTier.MEDIUM).bets()).isEqualTo(2);
        assertThat(stats.getByValueTier().get(ValueTier.MEDIUM).winRate()).isCloseTo(50.0, within(1e-9));
        assertThat(stats.getByValueTier().get(ValueTier.MEDIUM).pnl()).isCloseTo(30.0, within(1e-9));
        assertThat(stats.getByValueTier().get(ValueTier.HIGH).won()).isEqualTo(1);
        assertThat(stats.getByValueTier().get(ValueTier.NEUTRAL).bets()).isZero();
    }

    @Test
    void noSettledBetGivesEmptyStats() {
        when(betRepository.findByStatusIn(anyCollection())).thenReturn(List.of());
        when(betRepository.countByStatus(BetStatus.PENDING)).thenReturn(2L);

        PerformanceStats stats = performanceService.getPerformanceStats();

        assertThat(stats.getTotalBets()).isZero();
        assertThat(stats.getRoiPercent()).isZero();
        assertThat(stats.getPendingBets()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Courbe de bankroll : point de départ puis un point par pari réglé")
    void equityCurveFollowsSettlementOrder() {
        when(betRepository.findByStatusInAndSettledAtIsNotNullOrderBySettledAtAscIdAsc(anyCollection()))
                .thenReturn(threeBets());

        List<EquityPoint> curve = performanceService.getEquityCurve(1000.0);

        assertThat(curve).hasSize(4);
        assertThat(curve.get(0).timestamp()).isEqualTo(DAY);
        assertThat(curve.get(0).bankroll()).isEqualTo(1000.0);
        assertThat(curve).extracting(EquityPoint::bankroll).containsExactly(1000.0, 1150.0, 1100.0, 1180.0);
        assertThat(curve).extracting(EquityPoint::cumulativePnl).containsExactly(0.0, 150.0, 100.0, 180.0);
        assertThat(curve).extracting(EquityPoint::betCount).containsExactly(0, 1, 2, 3);
    }

    @Test
    void equityCurveWithoutBetsIsASinglePoint() {
        when(betRepository.findByStatusInAndSettledAtIsNotNullOrderBySettledAtAscIdAsc(anyCollection()))
                .thenReturn(List.of());

        List<EquityPoint> curve = performanceService.getEquityCurve(null);

        assertThat(curve).hasSize(1);
        assertThat(curve.get(0).bankroll()).isEqualTo(1000.0);
        assertThat(curve.get(0).betCount()).isZero();
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> performanceService.getEquityCurve(-5.0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> performanceService.getBetHistory(null, null, 0)).isInstanceOf(ValidationException.class);
    }
}
