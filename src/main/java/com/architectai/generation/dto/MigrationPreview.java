package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * What a reconciler run would do, computed without touching any file.
 */
@Getter
@AllArgsConstructor
public class MigrationPreview {

    @JsonProperty("legacy_groups")
    private final Map<String, LegacyGroup> legacyGroups;

    @JsonProperty("stable_artifacts")
    private final List<ArtifactCount> stableArtifacts;

    @JsonProperty("needs_migration")
    public boolean isNeedsMigration() {
        return !legacyGroups.isEmpty();
    }

    @Getter
    @AllArgsConstructor
    public static class LegacyGroup {
        @JsonProperty("artifacts")
        private final List<ArtifactCount> artifacts;
        @JsonProperty("total_versions")
        private final int totalVersions;
        @JsonProperty("stable_exists")
        private final boolean stableExists;
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ArtifactCount {
        @JsonProperty("artifact_id")
        private final String artifactId;
        @JsonProperty("version_count")
        private final int versionCount;
        @JsonProperty("created_at")
        private final OffsetDateTime createdAt;
    }
}
