package com.tony.footValue.service;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.exception.UnknownEntityException;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.ConfidenceLevel;
import com.tony.footValue.model.Match;
import com.tony.footValue.model.MatchStatus;
import com.tony.footValue.model.ValueAnalysis;
import com.tony.footValue.model.dto.SettlementReport;
import com.tony.footValue.repository.BetRecordRepository;
import com.tony.footValue.repository.MatchRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BetLedgerServiceTest {

    @Mock
    private BetRecordRepository betRepository;

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private ValueBettingService valueBettingService;

    @Mock
    private BettingProperties properties;

    @InjectMocks
    private BetLedgerService betLedgerService;

    private final ValueBettingService realValueService = new ValueBettingService(new BettingProperties());

    private Match match(long id, MatchStatus status, Integer homeGoals, Integer awayGoals) {
        Match match = new Match();
        match.setId(id);
        match.setStatus(status);
        match.setMatchDate(LocalDateTime.of(2025, 3, 1, 21, 0));
        match.setHomeGoals(homeGoals);
        match.setAwayGoals(awayGoals);
        return match;
    }

    private BetRecord pendingBet(long id, Match match, BetMarket market, double stake, double price) {
        return BetRecord.builder()
                .id(id)
                .match(match)
                .market(market)
                .stakeAmount(stake)
                .bankrollAtBet(1000.0)
                .price(price)
                .placedAt(LocalDateTime.of(2025, 3, 1, 12, 0))
                .build();
    }

    // =================================================================================
    // PLACEMENT
    // =================================================================================

    @Test
    @DisplayName("Placement : mise = Kelly borné x bankroll, pari PENDING")
    void placeBetStoresPendingBet() {
        when(matchRepository.findById(10L)).thenReturn(Optional.of(match(10L, MatchStatus.NS, null, null)));
        when(betRepository.save(any(BetRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        ValueAnalysis analysis = realValueService.analyze(BetMarket.HOME_WIN, 0.6, 2.0);

        BetRecord bet = betLedgerService.placeBet(10L, analysis, 1000.0, "test");

        assertThat(bet.getStatus()).isEqualTo(BetStatus.PENDING);
        assertThat(bet.getStakeAmount()).isCloseTo(200.0, within(1e-9));
        assertThat(bet.getStakeKellyFraction()).isCloseTo(0.2, within(1e-9));
        assertThat(bet.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(bet.getMarket()).isEqualTo(BetMarket.HOME_WIN);
        assertThat(bet.getPlacedAt()).isNotNull();
    }

    @Test
    void zeroStakeIsRejected() {
        when(matchRepository.findById(10L)).thenReturn(Optional.of(match(10L, MatchStatus.NS, null, null)));
        ValueAnalysis noValue = realValueService.analyze(BetMarket.HOME_WIN, 0.4, 2.0);

        assertThatThrownBy(() -> betLedgerService.placeBet(10L, noValue, 1000.0, null))
                .isInstanceOf(ValidationException.class);
        verify(betRepository, never()).save(any());
    }

    @Test
    void finishedMatchNoLongerAcceptsBets() {
        when(matchRepository.findById(10L)).thenReturn(Optional.of(match(10L, MatchStatus.FT, 1, 0)));
        ValueAnalysis analysis = realValueService.analyze(BetMarket.HOME_WIN, 0.6, 2.0);

        assertThatThrownBy(() -> betLedgerService.placeBet(10L, analysis, 1000.0, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownMatchIsReported() {
        when(matchRepository.findById(99L)).thenReturn(Optional.empty());
        ValueAnalysis analysis = realValueService.analyze(BetMarket.HOME_WIN, 0.6, 2.0);

        assertThatThrownBy(() -> betLedgerService.placeBet(99L, analysis, 1000.0, null))
                .isInstanceOf(UnknownEntityException.class);
    }

    @Test
    void invalidBankrollIsRejected() {
        ValueAnalysis analysis = realValueService.analyze(BetMarket.HOME_WIN, 0.6, 2.0);

        assertThatThrownBy(() -> betLedgerService.placeBet(10L, analysis, 0.0, null))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(matchRepository);
    }

    // =================================================================================
    // RÈGLEMENT
    // =================================================================================

    @Test
    @DisplayName("Règlement : 2-1, victoire domicile, 100 @ 2.50 -> +150")
    void settlementPassSettlesFinishedMatches() {
        BetRecord bet = pendingBet(1L, match(10L, MatchStatus.FT, 2, 1), BetMarket.HOME_WIN, 100.0, 2.50);
        when(betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT)).thenReturn(List.of(bet));

        SettlementReport report = betLedgerService.settlePendingBets();

        assertThat(report.settled()).isEqualTo(1);
        assertThat(report.won()).isEqualTo(1);
        assertThat(report.conflicts()).isZero();
        assertThat(bet.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(bet.getPnl()).isCloseTo(150.0, within(1e-9));
        verify(betRepository).saveAndFlush(bet);
    }

    @Test
    @DisplayName("Deux passes de règlement : chaque pari n'est réglé qu'une fois")
    void settlementIsIdempotent() {
        BetRecord bet = pendingBet(1L, match(10L, MatchStatus.FT, 2, 1), BetMarket.HOME_WIN, 100.0, 2.50);
        // La seconde passe relit le même pari, déjà WON : seul le garde-fou de statut l'arrête
        when(betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT))
                .thenReturn(List.of(bet))
                .thenReturn(List.of(bet));

        SettlementReport first = betLedgerService.settlePendingBets();
        Double pnl = bet.getPnl();
        Double bankrollAfter = bet.getBankrollAfter();
        LocalDateTime settledAt = bet.getSettledAt();
        SettlementReport second = betLedgerService.settlePendingBets();

        assertThat(first.settled()).isEqualTo(1);
        assertThat(bet.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(pnl).isCloseTo(150.0, within(1e-9));
        assertThat(bankrollAfter).isCloseTo(1150.0, within(1e-9));

        assertThat(second.candidates()).isEqualTo(1);
        assertThat(second.settled()).isZero();
        assertThat(second.conflicts()).isEqualTo(1);
        assertThat(bet.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(bet.getPnl()).isEqualTo(pnl);
        assertThat(bet.getBankrollAfter()).isEqualTo(bankrollAfter);
        assertThat(bet.getSettledAt()).isEqualTo(settledAt);
        verify(betRepository, times(1)).saveAndFlush(any());
    }

    @Test
    @DisplayName("Pari déjà réglé entre-temps : conflit compté, pas de second règlement")
    void alreadySettledBetIsAConflict() {
        BetRecord settled = pendingBet(1L, match(10L, MatchStatus.FT, 2, 1), BetMarket.HOME_WIN, 100.0, 2.50);
        settled.settle(2, 1, LocalDateTime.of(2025, 3, 1, 23, 0));
        Double pnl = settled.getPnl();
        when(betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT)).thenReturn(List.of(settled));

        SettlementReport report = betLedgerService.settlePendingBets();

        assertThat(report.conflicts()).isEqualTo(1);
        assertThat(report.settled()).isZero();
        assertThat(settled.getPnl()).isEqualTo(pnl);
        verify(betRepository, never()).saveAndFlush(any());
    }

    @Test
    void optimisticLockFailureDoesNotStopTheBatch() {
        Match finished = match(10L, MatchStatus.FT, 0, 2);
        BetRecord contested = pendingBet(1L, finished, BetMarket.HOME_WIN, 100.0, 2.50);
        BetRecord other = pendingBet(2L, finished, BetMarket.AWAY_WIN, 50.0, 3.0);
        when(betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT)).thenReturn(List.of(contested, other));
        when(betRepository.saveAndFlush(any(BetRecord.class))).thenAnswer(inv -> {
            if (inv.getArgument(0) == contested) {
                throw new ObjectOptimisticLockingFailureException(BetRecord.class, 1L);
            }
            return inv.getArgument(0);
        });

        SettlementReport report = betLedgerService.settlePendingBets();

        assertThat(report.candidates()).isEqualTo(2);
        assertThat(report.conflicts()).isEqualTo(1);
        assertThat(report.settled()).isEqualTo(1);
        assertThat(report.won()).isEqualTo(1);
        assertThat(other.getPnl()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void matchWithoutScoreIsSkipped() {
        BetRecord bet = pendingBet(1L, match(10L, MatchStatus.FT, null, null), BetMarket.DRAW, 10.0, 3.2);
        when(betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT)).thenReturn(List.of(bet));

        SettlementReport report = betLedgerService.settlePendingBets();

        assertThat(report.skipped()).isEqualTo(1);
        assertThat(bet.getStatus()).isEqualTo(BetStatus.PENDING);
    }
}
