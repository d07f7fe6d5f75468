package com.tony.footValue.job;

import com.tony.footValue.model.dto.SettlementReport;
import com.tony.footValue.service.BetLedgerService;
import com.tony.footValue.service.ModelSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ModelMaintenanceJob {

    private final ModelSnapshotService snapshotService;
    private final BetLedgerService betLedgerService;

    /**
     * JOB 1 : Reconstruction du snapshot (forces, Elo, cache de stats) sur l'historique à jour.
     * Le snapshot précédent reste servi tant que le nouveau n'est pas prêt.
     */
    @Scheduled(cron = "${jobs.rebuild-cron:0 0 9 * * *}")
    public void rebuildModel() {
        log.info("⏰ [CRON] Reconstruction du snapshot de modèles...");
        try {
            snapshotService.rebuild();
            log.info("✅ [CRON] Snapshot reconstruit.");
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de la reconstruction du snapshot", e);
        }
    }

    /**
     * JOB 2 : Règlement des paris dont le match est terminé.
     */
    @Scheduled(cron = "${jobs.settlement-cron:0 30 9 * * *}")
    public void settleBets() {
        log.info("⏰ [CRON] Règlement des paris en attente...");
        try {
            SettlementReport report = betLedgerService.settlePendingBets();
            log.info("   -> {}", report);
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du règlement des paris", e);
        }
    }
}
