package com.architectai.generation.controller;

import com.architectai.generation.dto.ApiError;
import com.architectai.generation.dto.ArtifactUpdateRequest;
import com.architectai.generation.dto.BulkGenerationRequest;
import com.architectai.generation.dto.BulkGenerationResult;
import com.architectai.generation.dto.GenerateResponse;
import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.GenerationJob;
import com.architectai.generation.model.JobStatus;
import com.architectai.generation.service.ArtifactEditService;
import com.architectai.generation.service.GenerationJobRunner;
import com.architectai.generation.service.JobRegistry;
import com.architectai.generation.service.NotificationHub;
import com.architectai.generation.service.StoreUnavailableException;
import com.architectai.generation.service.ThrottledException;
import com.architectai.generation.service.ValidationException;
import com.architectai.generation.service.VersionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/generation")
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);
    private static final int MAX_JOB_LIMIT = 500;

    private final GenerationJobRunner jobRunner;
    private final JobRegistry jobRegistry;
    private final VersionStore versionStore;
    private final ArtifactEditService artifactEditService;
    private final NotificationHub notificationHub;
    private final ObjectMapper objectMapper;
    private final long streamTimeoutMs;

    public GenerationController(GenerationJobRunner jobRunner,
                                JobRegistry jobRegistry,
                                VersionStore versionStore,
                                ArtifactEditService artifactEditService,
                                NotificationHub notificationHub,
                                ObjectMapper objectMapper,
                                @Value("${app.generation.stream-timeout-ms:300000}") long streamTimeoutMs) {
        this.jobRunner = jobRunner;
        this.jobRegistry = jobRegistry;
        this.versionStore = versionStore;
        this.artifactEditService = artifactEditService;
        this.notificationHub = notificationHub;
        this.objectMapper = objectMapper;
        this.streamTimeoutMs = streamTimeoutMs;
    }

    /**
     * Queues a generation job and returns its id without waiting for the result.
     */
    @Operation(
            summary = "Start artifact generation",
            description = "Validates the request, queues a generation job and returns its id. Progress is pushed on /ws/{job_id}; "
                    + "the job can also be polled on /generation/jobs/{job_id}."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job queued"),
            @ApiResponse(responseCode = "400", description = "Invalid generation request"),
            @ApiResponse(responseCode = "429", description = "Too many generation requests"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody(required = false) GenerationRequest request) {
        try {
            String jobId = jobRunner.submit(request);
            return ResponseEntity.ok(new GenerateResponse(jobId, JobStatus.QUEUED.wireValue()));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(ApiError.of("validation_error", e.getMessage()));
        } catch (ThrottledException e) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(ApiError.of("rate_limited", e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to submit generation request: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of("internal_error", e.getMessage()));
        }
    }

    @Operation(
            summary = "Start several generations at once",
            description = "Validates every item first, then queues one job per item. Items refused by the rate limiter "
                    + "are reported as failed without a job."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "One result per item, in request order"),
            @ApiResponse(responseCode = "400", description = "Empty batch or an invalid item; no job was queued"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/bulk")
    public ResponseEntity<?> bulkGenerate(@RequestBody(required = false) BulkGenerationRequest request) {
        try {
            List<BulkGenerationResult> results = jobRunner.submitBulk(request != null ? request.getItems() : null);
            return ResponseEntity.ok(results);
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(ApiError.of("validation_error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to submit bulk generation request: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of("internal_error", e.getMessage()));
        }
    }

    /**
     * Queues a generation job and streams its events as Server-Sent Events until it completes or fails.
     * The same events are published on {@code /ws/{job_id}}.
     */
    @Operation(
            summary = "Start artifact generation and stream its progress",
            description = "Server-Sent Events named after the job events (job.status, generation.progress, "
                    + "generation.complete, generation.error). A refused request ends with a single generation.error event."
    )
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody(required = false) GenerationRequest request, HttpServletResponse response) {
        response.setHeader("Cache-Control", "no-cache");
        response.setHeader("X-Accel-Buffering", "no");

        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        GenerationStreamSubscriber subscriber = new GenerationStreamSubscriber(emitter, objectMapper, notificationHub);
        try {
            String jobId = jobRunner.submit(request, subscriber);
            logger.info("Streaming job {} to {}", jobId, subscriber.getId());
        } catch (ValidationException e) {
            subscriber.reject("validation_error", e.getMessage());
        } catch (ThrottledException e) {
            subscriber.reject("rate_limited", e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to start streamed generation: {}", e.getMessage(), e);
            subscriber.reject("internal_error", e.getMessage());
        }
        return emitter;
    }

    @Operation(summary = "Get generation job status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job snapshot returned"),
            @ApiResponse(responseCode = "404", description = "Unknown job id")
    })
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJob(
            @Parameter(description = "Generation job ID", required = true)
            @PathVariable String jobId) {
        Optional<GenerationJob> job = jobRegistry.get(jobId);
        if (job.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", "Job " + jobId + " not found"));
        }
        return ResponseEntity.ok(job.get());
    }

    @Operation(summary = "List recent generation jobs", description = "Most recently created jobs first.")
    @GetMapping("/jobs")
    public ResponseEntity<List<GenerationJob>> listJobs(
            @Parameter(description = "Maximum number of jobs to return")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(jobRegistry.listRecent(Math.min(Math.max(limit, 0), MAX_JOB_LIMIT)));
    }

    @Operation(summary = "Get the current version of an artifact")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Current version returned"),
            @ApiResponse(responseCode = "404", description = "Artifact has no versions")
    })
    @GetMapping("/artifacts/{artifactId}")
    public ResponseEntity<?> getArtifact(
            @Parameter(description = "Artifact ID (equal to its artifact type)", required = true)
            @PathVariable String artifactId) {
        Optional<ArtifactVersion> current = versionStore.getCurrent(artifactId);
        if (current.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", "Artifact " + artifactId + " not found"));
        }
        return ResponseEntity.ok(current.get());
    }

    /**
     * Saves a manual edit as a new version of the artifact.
     */
    @Operation(
            summary = "Save manual edits for an artifact",
            description = "Appends the edited content as a new current version tagged update_type=manual_edit."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "New version created"),
            @ApiResponse(responseCode = "400", description = "Missing content"),
            @ApiResponse(responseCode = "404", description = "Artifact has no versions"),
            @ApiResponse(responseCode = "503", description = "Version store unavailable"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PutMapping("/artifacts/{artifactId}")
    public ResponseEntity<?> updateArtifact(
            @Parameter(description = "Artifact ID", required = true)
            @PathVariable String artifactId,
            @RequestBody(required = false) ArtifactUpdateRequest request) {
        try {
            Optional<ArtifactVersion> updated = artifactEditService.applyManualEdit(artifactId, request);
            if (updated.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", "Artifact " + artifactId + " not found"));
            }
            return ResponseEntity.ok(updated.get());
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(ApiError.of("validation_error", e.getMessage()));
        } catch (StoreUnavailableException e) {
            logger.error("Could not store manual edit of {}: {}", artifactId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.of("store_unavailable", e.getMessage()));
        } catch (Exception e) {
            logger.error("Failed to update artifact {}: {}", artifactId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of("internal_error", e.getMessage()));
        }
    }
}
