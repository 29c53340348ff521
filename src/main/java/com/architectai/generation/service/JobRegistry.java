package com.architectai.generation.service;

import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.ErrorCategory;
import com.architectai.generation.model.GenerationJob;
import com.architectai.generation.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Owns every generation job and its state machine.
 *
 * Each job is replaced as a whole inside {@link ConcurrentHashMap#compute}, which serializes
 * changes per job id; callers only ever get copies, so a poller can never see a half-applied
 * transition or a status that later moves backwards.
 */
@Service
public class JobRegistry {

    private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentHashMap<String, GenerationJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public JobRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a new queued job and returns its id.
     */
    public String create(String artifactType, GenerationRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        while (true) {
            String jobId = "gen_" + UUID.randomUUID().toString().replace("-", "");
            GenerationJob job = GenerationJob.builder()
                    .jobId(jobId)
                    .artifactType(artifactType)
                    .request(request != null ? request.copy() : null)
                    .status(JobStatus.QUEUED)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            if (jobs.putIfAbsent(jobId, job) == null) {
                logger.info("Job {} queued for artifact type {}", jobId, artifactType);
                return jobId;
            }
        }
    }

    public GenerationJob markRunning(String jobId) {
        return transition(jobId, JobStatus.RUNNING, job -> job.toBuilder()
                .status(JobStatus.RUNNING)
                .progress(0.0)
                .build());
    }

    public GenerationJob markCompleted(String jobId, String artifactId, int version) {
        return transition(jobId, JobStatus.COMPLETED, job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(100.0)
                .resultArtifactId(artifactId)
                .resultVersion(version)
                .build());
    }

    public GenerationJob markFailed(String jobId, ErrorCategory category, String error) {
        return transition(jobId, JobStatus.FAILED, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .errorCategory(category)
                .error(error != null ? error : "Unknown error")
                .build());
    }

    /**
     * Records progress of a running job. Progress is clamped to 0..100 and never decreases.
     *
     * @throws InvalidTransitionException if the job is not running
     */
    public GenerationJob updateProgress(String jobId, double percent, String message) {
        GenerationJob updated = jobs.compute(jobId, (id, job) -> {
            if (job == null) {
                throw new JobNotFoundException(id);
            }
            if (job.getStatus() != JobStatus.RUNNING) {
                throw new InvalidTransitionException(id, job.getStatus(), JobStatus.RUNNING);
            }
            double clamped = Math.max(job.getProgress(), Math.min(100.0, Math.max(0.0, percent)));
            return job.toBuilder()
                    .progress(clamped)
                    .progressMessage(message)
                    .updatedAt(OffsetDateTime.now(clock))
                    .build();
        });
        logger.debug("Job {} progress {}% {}", jobId, updated.getProgress(), message != null ? message : "");
        return updated.copy();
    }

    public Optional<GenerationJob> get(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        GenerationJob job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }

    /**
     * Most recently created jobs first.
     */
    public List<GenerationJob> listRecent(int limit) {
        return jobs.values().stream()
                .sorted(Comparator.comparing(GenerationJob::getCreatedAt).reversed())
                .limit(Math.max(0, limit))
                .map(GenerationJob::copy)
                .collect(Collectors.toList());
    }

    public long countActive() {
        return jobs.values().stream().filter(job -> !job.getStatus().isTerminal()).count();
    }

    private GenerationJob transition(String jobId, JobStatus target, UnaryOperator<GenerationJob> change) {
        GenerationJob updated = jobs.compute(jobId, (id, job) -> {
            if (job == null) {
                throw new JobNotFoundException(id);
            }
            if (!job.getStatus().canTransitionTo(target)) {
                throw new InvalidTransitionException(id, job.getStatus(), target);
            }
            GenerationJob next = change.apply(job);
            next.setUpdatedAt(OffsetDateTime.now(clock));
            return next;
        });
        logger.info("Job {} is now {}", jobId, updated.getStatus().wireValue());
        return updated.copy();
    }
}
