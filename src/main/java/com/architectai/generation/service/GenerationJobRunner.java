package com.architectai.generation.service;

import com.architectai.generation.dto.BulkGenerationResult;
import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.ErrorCategory;
import com.architectai.generation.model.GenerationJob;
import com.architectai.generation.model.JobStatus;
import com.architectai.generation.model.NotificationEvent;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts generation requests and drives each job from {@code queued} to a terminal status on the
 * worker pool.
 *
 * A version is appended only for a successful generation, and the job is marked completed only after
 * that append is durable. Terminal notifications go out after the registry transition, so a client
 * that receives {@code generation.complete} can always resolve the result.
 */
@Service
public class GenerationJobRunner {

    public static final String MDC_JOB_ID = "jobId";

    private static final Logger logger = LoggerFactory.getLogger(GenerationJobRunner.class);

    private final JobRegistry jobRegistry;
    private final VersionStore versionStore;
    private final NotificationHub notificationHub;
    private final ContentGenerator contentGenerator;
    private final GenerationRequestValidator validator;
    private final TaskExecutor executor;
    @SuppressWarnings("UnstableApiUsage")
    private final RateLimiter rateLimiter;

    @SuppressWarnings("UnstableApiUsage")
    public GenerationJobRunner(JobRegistry jobRegistry,
                               VersionStore versionStore,
                               NotificationHub notificationHub,
                               ContentGenerator contentGenerator,
                               GenerationRequestValidator validator,
                               @Qualifier("generationJobExecutor") TaskExecutor executor,
                               @Qualifier("generationRateLimiter") RateLimiter rateLimiter) {
        this.jobRegistry = jobRegistry;
        this.versionStore = versionStore;
        this.notificationHub = notificationHub;
        this.contentGenerator = contentGenerator;
        this.validator = validator;
        this.executor = executor;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Registers a job for the request and schedules it. Returns as soon as the job is queued.
     *
     * @throws ValidationException if the request is malformed; no job is created
     * @throws ThrottledException  if submissions exceed the configured rate; no job is created
     */
    public String submit(GenerationRequest request) {
        return submit(request, null);
    }

    /**
     * Like {@link #submit(GenerationRequest)}, but joins {@code observer} to the job's room before the
     * job is scheduled, so it sees every event of the job from {@code queued} on.
     */
    @SuppressWarnings("UnstableApiUsage")
    public String submit(GenerationRequest request, NotificationSubscriber observer) {
        validator.validate(request);
        if (!rateLimiter.tryAcquire()) {
            throw new ThrottledException("Too many generation requests, retry shortly");
        }

        GenerationRequest accepted = request.copy();
        String jobId = jobRegistry.create(accepted.getArtifactType(), accepted);
        if (observer != null) {
            notificationHub.subscribe(jobId, observer);
        }
        publishStatus(jobId, JobStatus.QUEUED, accepted.getArtifactType());

        try {
            executor.execute(() -> run(jobId, accepted));
        } catch (TaskRejectedException e) {
            logger.error("Worker pool rejected job {}: {}", jobId, e.getMessage());
            jobRegistry.markRunning(jobId);
            fail(jobId, ErrorCategory.SCHEDULING_FAILURE, "Job could not be scheduled: worker pool is saturated");
        }
        return jobId;
    }

    /**
     * Queues one job per item. Every item is validated before any job is created, so a malformed
     * item rejects the whole batch; an item refused by the rate limiter is reported as failed
     * without a job.
     *
     * @throws ValidationException if the batch is empty or any item is malformed
     */
    public List<BulkGenerationResult> submitBulk(List<GenerationRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new ValidationException("items must contain at least one generation request");
        }
        for (int i = 0; i < items.size(); i++) {
            try {
                validator.validate(items.get(i));
            } catch (ValidationException e) {
                throw new ValidationException("items[" + i + "]: " + e.getMessage());
            }
        }

        List<BulkGenerationResult> results = new ArrayList<>(items.size());
        for (GenerationRequest item : items) {
            try {
                results.add(BulkGenerationResult.queued(submit(item)));
            } catch (ThrottledException e) {
                logger.warn("Bulk item for {} was throttled: {}", item.getArtifactType(), e.getMessage());
                results.add(BulkGenerationResult.rejected(e.getMessage()));
            }
        }
        logger.info("Bulk submission queued {} of {} jobs",
                results.stream().filter(r -> r.getJobId() != null).count(), items.size());
        return results;
    }

    void run(String jobId, GenerationRequest request) {
        MDC.put(MDC_JOB_ID, jobId);
        try {
            execute(jobId, request);
        } catch (Error e) {
            logger.error("Job {} aborted by {}", jobId, e.toString(), e);
            failIfActive(jobId, e);
            throw e;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    /**
     * Fails a job that an {@link Error} left non-terminal, so pollers still see it end.
     */
    private void failIfActive(String jobId, Error cause) {
        try {
            GenerationJob job = jobRegistry.get(jobId).orElse(null);
            if (job == null || job.getStatus().isTerminal()) {
                return;
            }
            if (job.getStatus() == JobStatus.QUEUED) {
                jobRegistry.markRunning(jobId);
            }
            fail(jobId, ErrorCategory.GENERATION_FAILURE, "Unexpected error: " + cause);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private void execute(String jobId, GenerationRequest request) {
        String artifactType = request.getArtifactType();
        try {
            jobRegistry.markRunning(jobId);
            publishStatus(jobId, JobStatus.RUNNING, artifactType);

            GeneratedContent generated = contentGenerator.generate(request, (percent, message) -> reportProgress(jobId, percent, message));
            if (generated == null || !StringUtils.hasText(generated.getContent())) {
                throw new GenerationException("Generator returned no content for " + artifactType);
            }

            Map<String, Object> metadata = new LinkedHashMap<>(generated.getMetadata());
            metadata.put("job_id", jobId);
            metadata.put("model_used", generated.getModelUsed());
            metadata.put("update_type", "generation");
            ArtifactVersion version = versionStore.append(artifactType, generated.getContent(), metadata);

            GenerationJob completed = jobRegistry.markCompleted(jobId, version.getArtifactId(), version.getVersion());
            publishComplete(completed, version);
            logger.info("Job {} completed: {} version {}", jobId, version.getArtifactId(), version.getVersion());
        } catch (InvalidTransitionException e) {
            logger.error("Job {} state machine violated ({} -> {}); aborting", jobId, e.getFrom(), e.getTo(), e);
            throw e;
        } catch (StoreUnavailableException e) {
            logger.error("Job {} generated content but the version could not be stored: {}", jobId, e.getMessage(), e);
            fail(jobId, ErrorCategory.STORE_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Job {} failed during generation: {}", jobId, e.getMessage(), e);
            fail(jobId, ErrorCategory.GENERATION_FAILURE, e.getMessage());
        }
    }

    private void reportProgress(String jobId, double percent, String message) {
        GenerationJob job = jobRegistry.updateProgress(jobId, percent, message);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("progress", job.getProgress());
        data.put("message", message);
        notificationHub.publish(jobId, NotificationEvent.Type.GENERATION_PROGRESS, data);
    }

    private void fail(String jobId, ErrorCategory category, String error) {
        GenerationJob failed = jobRegistry.markFailed(jobId, category, error);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("status", failed.getStatus().wireValue());
        data.put("error", failed.getError());
        data.put("error_category", category.name());
        notificationHub.publish(jobId, NotificationEvent.Type.GENERATION_ERROR, data);
    }

    private void publishStatus(String jobId, JobStatus status, String artifactType) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", jobId);
        data.put("status", status.wireValue());
        data.put("artifact_type", artifactType);
        notificationHub.publish(jobId, NotificationEvent.Type.JOB_STATUS, data);
    }

    private void publishComplete(GenerationJob job, ArtifactVersion version) {
        Map<String, Object> artifact = new LinkedHashMap<>();
        artifact.put("artifact_id", version.getArtifactId());
        artifact.put("artifact_type", version.getArtifactType());
        artifact.put("version", version.getVersion());
        artifact.put("content", version.getContent());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.getJobId());
        data.put("status", job.getStatus().wireValue());
        data.put("artifact_id", version.getArtifactId());
        data.put("version", version.getVersion());
        data.put("artifact", artifact);
        notificationHub.publish(job.getJobId(), NotificationEvent.Type.GENERATION_COMPLETE, data);
    }
}
