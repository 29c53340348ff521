package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Outcome of one reconciler run. A run with nothing left to migrate reports all zeros.
 */
@Getter
@Builder
public class MigrationReport {

    @JsonProperty("migrated_versions")
    private final int migratedVersions;

    @JsonProperty("artifacts_consolidated")
    private final int artifactsConsolidated;

    @JsonProperty("legacy_groups")
    private final int legacyGroups;

    @JsonProperty("stable_ids_unchanged")
    private final int stableIdsUnchanged;

    /** Base types whose interrupted migration was finished by deleting the leftover legacy files. */
    @Singular("completedGroup")
    @JsonProperty("completed_groups")
    private final List<String> completedGroups;

    /** Base types left alone because a stable history without their provenance already exists. */
    @Singular("skippedGroup")
    @JsonProperty("skipped_groups")
    private final List<String> skippedGroups;

    @Singular("failedGroup")
    @JsonProperty("failed_groups")
    private final List<String> failedGroups;

    @JsonProperty("success")
    public boolean isSuccess() {
        return failedGroups.isEmpty();
    }
}
