package com.tony.footValue.model;

import com.tony.footValue.exception.SettlementConflictException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Pari placé. Créé PENDING, modifié une seule fois au règlement, puis figé.
 */
@Entity
@Table(name = "bet_history", indexes = {
        @Index(name = "idx_bet_status", columnList = "status"),
        @Index(name = "idx_bet_settled_at", columnList = "settledAt")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BetRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Verrou optimiste : deux passes de règlement concurrentes ne peuvent pas régler le même pari
    @Version
    private Long version;

    @ManyToOne(optional = false)
    @JoinColumn(name = "match_id")
    private Match match;

    // --- Marché & mise ---
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private BetMarket market;
    private String marketName;

    private double stakeKellyFraction;
    private double stakeAmount;
    private double bankrollAtBet;

    // --- Cote & analyse ---
    private double price;
    private boolean estimatedPrice;
    private double probability;
    private double expectedValue;
    private double edgePercentage;

    @Enumerated(EnumType.STRING)
    private ValueTier valueTier;

    @Enumerated(EnumType.STRING)
    private ConfidenceLevel confidenceLevel;

    // --- Règlement ---
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    @Builder.Default
    private BetStatus status = BetStatus.PENDING;

    private String actualResult; // "H", "D" ou "A"
    private Boolean winner;
    private Double pnl;
    private Double roiPercent;
    private Double bankrollAfter;

    @Column(nullable = false)
    private LocalDateTime placedAt;
    private LocalDateTime settledAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    /**
     * Règle le pari sur le score final.
     * @throws SettlementConflictException si le pari n'est plus PENDING
     */
    public void settle(int homeGoals, int awayGoals, LocalDateTime at) {
        if (status != BetStatus.PENDING) {
            throw new SettlementConflictException("Pari " + id + " déjà réglé (" + status + ")");
        }
        boolean won = market.wins(homeGoals, awayGoals);
        double profit = won ? stakeAmount * (price - 1.0) : -stakeAmount;

        this.actualResult = BetMarket.resultCode(homeGoals, awayGoals);
        this.winner = won;
        this.pnl = profit;
        this.roiPercent = stakeAmount > 0 ? profit / stakeAmount * 100.0 : 0.0;
        this.bankrollAfter = bankrollAtBet + profit;
        this.settledAt = at;
        this.status = won ? BetStatus.WON : BetStatus.LOST;
    }
}
