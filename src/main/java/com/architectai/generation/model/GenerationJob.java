package com.architectai.generation.model;

import com.architectai.generation.dto.GenerationRequest;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A single asynchronous request to produce a new artifact version.
 *
 * Instances handed out by {@code JobRegistry} are snapshots; mutating them has no effect on the registry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationJob {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("artifact_type")
    private String artifactType;

    @JsonProperty("request")
    private GenerationRequest request;

    @JsonProperty("status")
    private JobStatus status;

    @JsonProperty("progress")
    private double progress;

    @JsonProperty("progress_message")
    private String progressMessage;

    @JsonProperty("result_artifact_id")
    private String resultArtifactId;

    @JsonProperty("result_version")
    private Integer resultVersion;

    @JsonProperty("error")
    private String error;

    @JsonProperty("error_category")
    private ErrorCategory errorCategory;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    public GenerationJob copy() {
        return toBuilder()
                .request(request != null ? request.copy() : null)
                .build();
    }
}
