package com.tony.footValue.config;

import com.tony.footValue.service.ModelSnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Construit le premier snapshot au démarrage. Sans lui, les prédictions répondent 409
 * jusqu'à la première reconstruction explicite.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotInitializer implements CommandLineRunner {

    private final ModelSnapshotService snapshotService;
    private final PredictionProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.isBuildSnapshotOnStartup()) {
            log.info("⏸️ Construction du snapshot au démarrage désactivée");
            return;
        }
        log.info("🌱 Construction du snapshot initial...");
        snapshotService.rebuild();
    }
}
