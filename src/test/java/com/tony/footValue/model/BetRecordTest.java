package com.tony.footValue.model;

import com.tony.footValue.exception.SettlementConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BetRecordTest {

    private static final LocalDateTime SETTLED_AT = LocalDateTime.of(2025, 3, 1, 22, 0);

    private BetRecord pendingBet(BetMarket market, double stake, double price) {
        return BetRecord.builder()
                .id(1L)
                .market(market)
                .stakeAmount(stake)
                .bankrollAtBet(1000.0)
                .price(price)
                .placedAt(SETTLED_AT.minusDays(1))
                .build();
    }

    @Test
    @DisplayName("Victoire domicile 2-1, mise 100 @ 2.50 : +150, ROI 150%")
    void homeWinIsSettledAsWon() {
        BetRecord bet = pendingBet(BetMarket.HOME_WIN, 100.0, 2.50);

        bet.settle(2, 1, SETTLED_AT);

        assertThat(bet.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(bet.getWinner()).isTrue();
        assertThat(bet.getActualResult()).isEqualTo("H");
        assertThat(bet.getPnl()).isCloseTo(150.0, within(1e-9));
        assertThat(bet.getRoiPercent()).isCloseTo(150.0, within(1e-9));
        assertThat(bet.getBankrollAfter()).isCloseTo(1150.0, within(1e-9));
        assertThat(bet.getSettledAt()).isEqualTo(SETTLED_AT);
    }

    @Test
    void lostBetCostsTheStake() {
        BetRecord bet = pendingBet(BetMarket.AWAY_WIN, 100.0, 3.10);

        bet.settle(2, 1, SETTLED_AT);

        assertThat(bet.getStatus()).isEqualTo(BetStatus.LOST);
        assertThat(bet.getWinner()).isFalse();
        assertThat(bet.getPnl()).isCloseTo(-100.0, within(1e-9));
        assertThat(bet.getRoiPercent()).isCloseTo(-100.0, within(1e-9));
        assertThat(bet.getBankrollAfter()).isCloseTo(900.0, within(1e-9));
    }

    @Test
    void goalMarketsAreSettledOnTheScore() {
        BetRecord over = pendingBet(BetMarket.OVER_25, 50.0, 1.9);
        BetRecord combo = pendingBet(BetMarket.DRAW_AND_BTTS, 20.0, 6.0);

        over.settle(2, 1, SETTLED_AT);
        combo.settle(1, 1, SETTLED_AT);

        assertThat(over.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(over.getPnl()).isCloseTo(45.0, within(1e-9));
        assertThat(combo.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(combo.getActualResult()).isEqualTo("D");
    }

    @Test
    @DisplayName("Un pari réglé ne peut pas l'être une seconde fois")
    void settlingTwiceIsAConflict() {
        BetRecord bet = pendingBet(BetMarket.HOME_WIN, 100.0, 2.50);
        bet.settle(2, 1, SETTLED_AT);

        assertThatThrownBy(() -> bet.settle(0, 3, SETTLED_AT.plusHours(1)))
                .isInstanceOf(SettlementConflictException.class);
        assertThat(bet.getStatus()).isEqualTo(BetStatus.WON);
        assertThat(bet.getPnl()).isCloseTo(150.0, within(1e-9));
        assertThat(bet.getSettledAt()).isEqualTo(SETTLED_AT);
    }
}
