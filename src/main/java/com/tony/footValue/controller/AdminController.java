package com.tony.footValue.controller;

import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.engine.TeamRating;
import com.tony.footValue.job.ModelMaintenanceJob;
import com.tony.footValue.model.dto.MatchFeatures;
import com.tony.footValue.repository.MatchHistoryStore;
import com.tony.footValue.service.FeatureExportService;
import com.tony.footValue.service.FeatureService;
import com.tony.footValue.service.ModelSnapshotService;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final ModelSnapshotService snapshotService;
    private final ModelMaintenanceJob maintenanceJob;
    private final FeatureService featureService;
    private final FeatureExportService featureExportService;
    private final MatchHistoryStore historyStore;

    @PostMapping("/model/rebuild")
    public ResponseEntity<Map<String, Object>> rebuildModel() {
        log.info("🔄 Reconstruction du snapshot demandée par l'admin");
        ModelSnapshot snapshot = snapshotService.rebuild();
        return ResponseEntity.ok(Map.of(
                "builtAt", snapshot.builtAt().toString(),
                "matches", snapshot.matchCount(),
                "schemaVersion", snapshot.featureSchemaVersion()));
    }

    /**
     * Exécute manuellement les jobs quotidiens (reconstruction puis règlement).
     */
    @PostMapping("/force-daily-jobs")
    public ResponseEntity<String> forceDailyJobs() {
        log.info("🚀 Lancement manuel des jobs quotidiens demandé par l'admin");
        maintenanceJob.rebuildModel();
        maintenanceJob.settleBets();
        return ResponseEntity.ok("✅ Jobs exécutés. Vérifiez les logs pour les détails.");
    }

    @GetMapping("/elo/top")
    public ResponseEntity<List<TeamRating>> getTopElo(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(snapshotService.requireCurrent().elo().topTeams(limit));
    }

    /** Jeu de features de tout l'historique, en CSV. */
    @GetMapping(value = "/features/export", produces = "text/csv")
    public void exportFeatures(HttpServletResponse response) throws IOException {
        ModelSnapshot snapshot = snapshotService.requireCurrent();
        List<MatchFeatures> rows = featureService.buildDataset(snapshot, historyStore.listFinishedMatches(null, null));
        response.setContentType("text/csv");
        response.setCharacterEncoding("UTF-8");
        response.setHeader("Content-Disposition", "attachment; filename=features-" + snapshot.featureSchemaVersion() + ".csv");
        featureExportService.exportCsv(rows, response.getWriter());
    }
}
