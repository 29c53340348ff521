package com.architectai.generation.service;

import com.architectai.generation.dto.ArtifactUpdateRequest;
import com.architectai.generation.model.ArtifactVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Saves user edits of generated artifacts as new versions.
 */
@Service
public class ArtifactEditService {

    public static final String UPDATE_TYPE_MANUAL_EDIT = "manual_edit";

    /** Provenance keys only the service itself may write; client values for them are dropped. */
    static final Set<String> RESERVED_METADATA_KEYS = Set.of(
            MigrationReconciler.MIGRATED_FROM, "job_id", "model_used", "restored_from", "restored_at",
            "update_type", "updated_at");

    private static final Logger logger = LoggerFactory.getLogger(ArtifactEditService.class);

    private final VersionStore versionStore;
    private final Clock clock;

    public ArtifactEditService(VersionStore versionStore, Clock clock) {
        this.versionStore = versionStore;
        this.clock = clock;
    }

    /**
     * Appends the edited content as the new current version.
     *
     * @return empty if the artifact has no versions yet; edits never create an artifact
     * @throws ValidationException if the edit carries no content
     */
    public Optional<ArtifactVersion> applyManualEdit(String artifactId, ArtifactUpdateRequest request) {
        if (request == null || !StringUtils.hasText(request.getContent())) {
            throw new ValidationException("content is required");
        }
        if (!versionStore.exists(artifactId)) {
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.getMetadata() != null) {
            request.getMetadata().forEach((key, value) -> {
                if (RESERVED_METADATA_KEYS.contains(key)) {
                    logger.warn("Ignoring reserved metadata key '{}' in manual edit of {}", key, artifactId);
                } else {
                    metadata.put(key, value);
                }
            });
        }
        metadata.put("update_type", UPDATE_TYPE_MANUAL_EDIT);
        metadata.put("updated_at", OffsetDateTime.now(clock).toString());

        ArtifactVersion version = versionStore.append(artifactId, request.getContent(), metadata);
        logger.info("Saved manual edit of {} as version {}", artifactId, version.getVersion());
        return Optional.of(version);
    }
}
