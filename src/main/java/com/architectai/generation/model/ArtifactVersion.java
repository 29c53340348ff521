package com.architectai.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable entry of an artifact's version history.
 *
 * The JSON shape (snake_case) is also the on-disk record format of the version files.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactVersion {

    @JsonProperty("artifact_id")
    private String artifactId;

    @JsonProperty("artifact_type")
    private String artifactType;

    @JsonProperty("version")
    private Integer version;

    @JsonProperty("content")
    private String content;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("is_current")
    private boolean current;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    /**
     * Returns a copy that shares no mutable state with this record.
     */
    public ArtifactVersion copy() {
        return toBuilder()
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
    }
}
