package com.tony.footValue.service;

import com.tony.footValue.config.BettingProperties;
import com.tony.footValue.exception.SettlementConflictException;
import com.tony.footValue.exception.UnknownEntityException;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.BetMarket;
import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.ConfidenceLevel;
import com.tony.footValue.model.Match;
import com.tony.footValue.model.MatchStatus;
import com.tony.footValue.model.ValueAnalysis;
import com.tony.footValue.model.dto.PlaceBetRequest;
import com.tony.footValue.model.dto.SettlementReport;
import com.tony.footValue.repository.BetRecordRepository;
import com.tony.footValue.repository.MatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Cycle de vie des paris : PENDING à la création, WON ou LOST au règlement, puis figé.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BetLedgerService {

    private final BetRecordRepository betRepository;
    private final MatchRepository matchRepository;
    private final ValueBettingService valueBettingService;
    private final BettingProperties properties;

    /**
     * Analyse le marché demandé (cote réelle ou estimée) puis place le pari.
     */
    public BetRecord placeBet(PlaceBetRequest request) {
        BetMarket market = BetMarket.fromCode(request.getMarket())
                .orElseThrow(() -> new ValidationException("Marché inconnu : " + request.getMarket()));
        OptionalDouble price = request.getPrice() == null ? OptionalDouble.empty() : OptionalDouble.of(request.getPrice());
        ValueAnalysis analysis = valueBettingService.analyzeWithEstimate(market, request.getProbability(), price);
        double bankroll = request.getBankroll() == null ? properties.getInitialBankroll() : request.getBankroll();
        return placeBet(request.getMatchId(), analysis, bankroll, request.getNotes());
    }

    /**
     * Enregistre un pari PENDING, mise = fraction Kelly bornée x bankroll.
     * @throws ValidationException si la mise est nulle ou si le match n'accepte plus de paris
     */
    public BetRecord placeBet(Long matchId, ValueAnalysis analysis, double bankroll, String notes) {
        if (analysis == null || analysis.market() == null) {
            throw new ValidationException("Une analyse rattachée à un marché est requise");
        }
        if (Double.isNaN(bankroll) || bankroll <= 0.0) {
            throw new ValidationException("Bankroll invalide : " + bankroll);
        }
        if (matchId == null) {
            throw new ValidationException("Identifiant de match requis");
        }
        Match match = matchRepository.findById(matchId)
                .orElseThrow(() -> new UnknownEntityException("Match", matchId));
        if (match.getStatus() != null && match.getStatus().isTerminal()) {
            throw new ValidationException("Match " + matchId + " déjà terminé (" + match.getStatus() + ")");
        }

        double stake = analysis.cappedKellyFraction() * bankroll;
        if (stake <= 0.0) {
            throw new ValidationException("Mise nulle : aucune value sur " + analysis.market().getCode());
        }

        BetRecord bet = BetRecord.builder()
                .match(match)
                .market(analysis.market())
                .marketName(analysis.market().getLabel())
                .stakeKellyFraction(analysis.cappedKellyFraction())
                .stakeAmount(stake)
                .bankrollAtBet(bankroll)
                .price(analysis.price())
                .estimatedPrice(analysis.estimatedPrice())
                .probability(analysis.probability())
                .expectedValue(analysis.expectedValue())
                .edgePercentage(analysis.edgePercentage())
                .valueTier(analysis.valueTier())
                .confidenceLevel(ConfidenceLevel.fromKellyPercent(analysis.kellyPercent()))
                .status(BetStatus.PENDING)
                .placedAt(LocalDateTime.now())
                .notes(notes)
                .build();

        BetRecord saved = betRepository.save(bet);
        log.info("🎯 Pari placé : {} sur match {} - mise {} @ {}", analysis.market().getCode(), matchId,
                round(stake), analysis.price());
        return saved;
    }

    /**
     * Règle tous les paris PENDING dont le match est terminé (FT).
     * Idempotent : un pari déjà réglé n'est jamais re-réglé. Un conflit (pari réglé entre-temps
     * par une autre passe) est journalisé et ignoré, sans interrompre le batch.
     */
    public SettlementReport settlePendingBets() {
        List<BetRecord> candidates = betRepository.findSettleable(BetStatus.PENDING, MatchStatus.FT);
        int settled = 0, won = 0, lost = 0, conflicts = 0, skipped = 0;

        for (BetRecord bet : candidates) {
            Match match = bet.getMatch();
            if (!match.isFinished()) {
                log.warn("⚠️ Pari {} : match {} terminé sans score, règlement reporté", bet.getId(), match.getId());
                skipped++;
                continue;
            }
            try {
                bet.settle(match.getHomeGoals(), match.getAwayGoals(), LocalDateTime.now());
                betRepository.saveAndFlush(bet);
                settled++;
                if (bet.getStatus() == BetStatus.WON) won++;
                else lost++;
            } catch (SettlementConflictException | OptimisticLockingFailureException e) {
                log.warn("⚠️ Conflit de règlement sur le pari {} : {}", bet.getId(), e.getMessage());
                conflicts++;
            }
        }

        log.info("✅ Règlement : {} paris réglés ({} gagnés, {} perdus), {} conflits, {} reportés",
                settled, won, lost, conflicts, skipped);
        return new SettlementReport(candidates.size(), settled, won, lost, conflicts, skipped);
    }

    private double round(double val) { return Math.round(val * 100.0) / 100.0; }
}
