package com.architectai.generation.config;

import com.architectai.generation.dto.MigrationReport;
import com.architectai.generation.service.MigrationReconciler;
import com.architectai.generation.service.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * At startup, loads every stable version history and, unless disabled, folds legacy
 * timestamp-suffixed files into them first. Requests are only served once this has run.
 */
@Component
@Order(1)
public class VersionStoreInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(VersionStoreInitializer.class);

    private final VersionStore versionStore;
    private final MigrationReconciler migrationReconciler;
    private final boolean autoMigrate;
    private volatile boolean ready;

    public VersionStoreInitializer(VersionStore versionStore,
                                   MigrationReconciler migrationReconciler,
                                   @Value("${app.versions.auto-migrate:true}") boolean autoMigrate) {
        this.versionStore = versionStore;
        this.migrationReconciler = migrationReconciler;
        this.autoMigrate = autoMigrate;
    }

    @Override
    public void run(ApplicationArguments args) {
        // Stable histories must be in memory so the reconciler can see which base types already exist.
        versionStore.reload();
        if (autoMigrate) {
            migrate();
        } else {
            logger.info("Legacy version migration disabled (app.versions.auto-migrate=false)");
        }
        ready = true;
    }

    public boolean isReady() {
        return ready;
    }

    private void migrate() {
        MigrationReport report = migrationReconciler.reconcile();
        if (!report.isSuccess()) {
            logger.error("Legacy version migration left {} group(s) unmigrated: {}", report.getFailedGroups().size(), report.getFailedGroups());
        } else if (!report.getSkippedGroups().isEmpty()) {
            logger.warn("Legacy version migration skipped {} group(s) that need manual review: {}",
                    report.getSkippedGroups().size(), report.getSkippedGroups());
        }
    }
}
