package com.architectai.generation.controller;

import com.architectai.generation.dto.ApiError;
import com.architectai.generation.dto.MigrationPreview;
import com.architectai.generation.dto.MigrationReport;
import com.architectai.generation.dto.VersionComparison;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.service.MigrationReconciler;
import com.architectai.generation.service.StoreUnavailableException;
import com.architectai.generation.service.VersionStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to version histories plus restore, compare and legacy migration.
 */
@RestController
@RequestMapping("/versions")
public class VersionController {

    private static final Logger logger = LoggerFactory.getLogger(VersionController.class);

    private final VersionStore versionStore;
    private final MigrationReconciler migrationReconciler;

    public VersionController(VersionStore versionStore, MigrationReconciler migrationReconciler) {
        this.versionStore = versionStore;
        this.migrationReconciler = migrationReconciler;
    }

    @Operation(summary = "List artifact ids that have at least one version")
    @GetMapping
    public ResponseEntity<Set<String>> listArtifacts() {
        return ResponseEntity.ok(versionStore.listArtifactIds());
    }

    @Operation(summary = "List all versions of an artifact", description = "Ascending version order; empty when the artifact is unknown.")
    @GetMapping("/{artifactId}")
    public ResponseEntity<List<ArtifactVersion>> listVersions(
            @Parameter(description = "Artifact ID", required = true)
            @PathVariable String artifactId) {
        return ResponseEntity.ok(versionStore.listVersions(artifactId));
    }

    @Operation(summary = "Get the current version of an artifact")
    @GetMapping("/{artifactId}/current")
    public ResponseEntity<?> getCurrent(@PathVariable String artifactId) {
        return versionOrNotFound(versionStore.getCurrent(artifactId), "No versions found for " + artifactId);
    }

    @Operation(summary = "Get a specific version of an artifact")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Version returned"),
            @ApiResponse(responseCode = "404", description = "Version not found")
    })
    @GetMapping("/{artifactId}/{version}")
    public ResponseEntity<?> getVersion(@PathVariable String artifactId, @PathVariable int version) {
        return versionOrNotFound(versionStore.getVersion(artifactId, version),
                "Version " + version + " not found for " + artifactId);
    }

    @Operation(summary = "Compare two versions of an artifact", description = "Size, line and character-set similarity summary.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Comparison returned"),
            @ApiResponse(responseCode = "404", description = "One of the versions does not exist")
    })
    @PostMapping("/{artifactId}/compare")
    public ResponseEntity<?> compare(@PathVariable String artifactId,
                                     @RequestParam("version1") int version1,
                                     @RequestParam("version2") int version2) {
        Optional<VersionComparison> comparison = versionStore.compare(artifactId, version1, version2);
        if (comparison.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiError.of("not_found", "Could not compare versions " + version1 + " and " + version2 + " of " + artifactId));
        }
        return ResponseEntity.ok(comparison.get());
    }

    /**
     * Restores an older version by appending a copy of it; history itself is never rewritten.
     */
    @Operation(summary = "Restore a previous version", description = "Creates a new current version with the content of the given one.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Restored as a new version"),
            @ApiResponse(responseCode = "404", description = "Version not found"),
            @ApiResponse(responseCode = "503", description = "Version store unavailable")
    })
    @PostMapping("/{artifactId}/restore/{version}")
    public ResponseEntity<?> restore(@PathVariable String artifactId, @PathVariable int version) {
        try {
            return versionOrNotFound(versionStore.restore(artifactId, version),
                    "Version " + version + " not found for " + artifactId);
        } catch (StoreUnavailableException e) {
            logger.error("Failed to restore version {} of {}: {}", version, artifactId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.of("store_unavailable", e.getMessage()));
        }
    }

    @Operation(summary = "Preview legacy version migration", description = "Lists timestamp-suffixed histories that would be consolidated.")
    @GetMapping("/migration/preview")
    public ResponseEntity<MigrationPreview> previewMigration() {
        return ResponseEntity.ok(migrationReconciler.preview());
    }

    @Operation(summary = "Run legacy version migration", description = "Idempotent; does nothing once no legacy histories remain.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Migration report"),
            @ApiResponse(responseCode = "500", description = "Migration failed for at least one group")
    })
    @PostMapping("/migration")
    public ResponseEntity<?> migrate() {
        try {
            MigrationReport report = migrationReconciler.reconcile();
            return report.isSuccess()
                    ? ResponseEntity.ok(report)
                    : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(report);
        } catch (Exception e) {
            logger.error("Legacy version migration failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of("migration_failed", e.getMessage()));
        }
    }

    private ResponseEntity<?> versionOrNotFound(Optional<ArtifactVersion> version, String message) {
        if (version.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", message));
        }
        return ResponseEntity.ok(version.get());
    }
}
