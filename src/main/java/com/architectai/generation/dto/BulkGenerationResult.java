package com.architectai.generation.dto;

import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.JobStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one item of a bulk submission. Jobs run asynchronously, so {@code artifact} is only
 * filled in by callers that resolved a finished job.
 */
@Getter
@AllArgsConstructor
public class BulkGenerationResult {

    @JsonProperty("job_id")
    private final String jobId;

    @JsonProperty("status")
    private final JobStatus status;

    @JsonProperty("artifact")
    private final ArtifactVersion artifact;

    @JsonProperty("error")
    private final String error;

    public static BulkGenerationResult queued(String jobId) {
        return new BulkGenerationResult(jobId, JobStatus.QUEUED, null, null);
    }

    public static BulkGenerationResult rejected(String error) {
        return new BulkGenerationResult(null, JobStatus.FAILED, null, error);
    }
}
