package com.architectai.generation.service;

import com.architectai.generation.TestClock;
import com.architectai.generation.dto.BulkGenerationResult;
import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.ErrorCategory;
import com.architectai.generation.model.GenerationJob;
import com.architectai.generation.model.JobStatus;
import com.architectai.generation.model.NotificationEvent;
import com.architectai.generation.repository.JsonFileVersionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SuppressWarnings("UnstableApiUsage")
class GenerationJobRunnerTest {

    @TempDir
    Path tempDir;

    private final List<Runnable> scheduled = new ArrayList<>();
    private final TaskExecutor deferredExecutor = scheduled::add;

    private TestClock clock;
    private VersionStore versionStore;
    private JobRegistry jobRegistry;
    private NotificationHub hub;
    private GenerationRequestValidator validator;

    @BeforeEach
    void setUp() {
        clock = TestClock.at("2026-01-15T10:00:00Z");
        versionStore = new VersionStore(new JsonFileVersionRepository(new ObjectMapper(), tempDir.toString()), clock);
        versionStore.reload();
        jobRegistry = new JobRegistry(clock);
        hub = new NotificationHub(new ObjectMapper(), clock);
        validator = new GenerationRequestValidator(List.of(), 10);
    }

    @Test
    void repeatedGenerationAppendsSuccessiveVersionsOfTheSameArtifact() {
        GenerationJobRunner runner = runner(stubGenerator("graph TD; A-->B", "graph TD; A-->C"), deferredExecutor);

        String firstJob = runner.submit(request("diagram_x"));
        runScheduled();
        String secondJob = runner.submit(request("diagram_x"));
        runScheduled();

        GenerationJob first = jobRegistry.get(firstJob).orElseThrow();
        GenerationJob second = jobRegistry.get(secondJob).orElseThrow();
        assertThat(first.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(first.getResultArtifactId()).isEqualTo("diagram_x");
        assertThat(first.getResultVersion()).isEqualTo(1);
        assertThat(second.getResultVersion()).isEqualTo(2);

        ArtifactVersion current = versionStore.getCurrent("diagram_x").orElseThrow();
        assertThat(current.getVersion()).isEqualTo(2);
        assertThat(current.getContent()).isEqualTo("graph TD; A-->C");
        assertThat(current.getMetadata()).containsEntry("job_id", secondJob).containsEntry("model_used", "stub-model");
        assertThat(versionStore.getVersion("diagram_x", 1).orElseThrow().getContent()).isEqualTo("graph TD; A-->B");
    }

    @Test
    void subscriberSeesLifecycleEventsAndCanResolveTheResultOnCompletion() {
        GenerationJobRunner runner = runner(stubGenerator("erDiagram"), deferredExecutor);
        String jobId = runner.submit(request("mermaid_erd"));

        AtomicReference<GenerationJob> jobAtCompletion = new AtomicReference<>();
        AtomicReference<ArtifactVersion> versionAtCompletion = new AtomicReference<>();
        RecordingSubscriber subscriber = new RecordingSubscriber("client") {
            @Override
            public void send(NotificationEvent event) throws java.io.IOException {
                if (event.getType() == NotificationEvent.Type.GENERATION_COMPLETE) {
                    jobAtCompletion.set(jobRegistry.get(jobId).orElseThrow());
                    versionAtCompletion.set(versionStore.getCurrent("mermaid_erd").orElse(null));
                }
                super.send(event);
            }
        };
        hub.subscribe(jobId, subscriber);
        runScheduled();

        assertThat(subscriber.types()).containsExactly(
                "connection.established", "job.status", "generation.progress", "generation.progress", "generation.complete");
        assertThat(jobAtCompletion.get().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(versionAtCompletion.get().getVersion()).isEqualTo(jobAtCompletion.get().getResultVersion());
        NotificationEvent complete = subscriber.received().get(4);
        assertThat(complete.getData()).containsEntry("artifact_id", "mermaid_erd").containsEntry("version", 1);
    }

    @Test
    void errorThrownByTheGeneratorStillFailsTheJob() {
        ContentGenerator generator = (request, progress) -> {
            throw new NoClassDefFoundError("software/amazon/awssdk/services/bedrockruntime/BedrockRuntimeClient");
        };
        GenerationJobRunner runner = runner(generator, deferredExecutor);
        String jobId = runner.submit(request("diagram_x"));
        RecordingSubscriber subscriber = new RecordingSubscriber("client");
        hub.subscribe(jobId, subscriber);

        assertThatThrownBy(this::runScheduled).isInstanceOf(NoClassDefFoundError.class);

        GenerationJob job = jobRegistry.get(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCategory()).isEqualTo(ErrorCategory.GENERATION_FAILURE);
        assertThat(job.getError()).contains("NoClassDefFoundError");
        assertThat(subscriber.types()).endsWith("generation.error");
        assertThat(versionStore.exists("diagram_x")).isFalse();
        assertThat(MDC.get(GenerationJobRunner.MDC_JOB_ID)).isNull();
    }

    @Test
    void progressReportedByTheGeneratorIsVisibleToPollers() {
        AtomicReference<String> jobIdHolder = new AtomicReference<>();
        AtomicReference<Double> progressSeen = new AtomicReference<>();
        ContentGenerator generator = (request, progress) -> {
            progress.onProgress(40.0, "Generating...");
            progressSeen.set(jobRegistry.get(jobIdHolder.get()).orElseThrow().getProgress());
            return new GeneratedContent("content", "stub-model");
        };
        GenerationJobRunner runner = runner(generator, deferredExecutor);
        jobIdHolder.set(runner.submit(request("a")));

        runScheduled();

        assertThat(progressSeen.get()).isEqualTo(40.0);
    }

    @Test
    void generatorFailureFailsTheJobWithoutWritingAVersion() {
        ContentGenerator generator = (request, progress) -> {
            throw new GenerationException("model unavailable");
        };
        GenerationJobRunner runner = runner(generator, deferredExecutor);
        String jobId = runner.submit(request("diagram_x"));
        RecordingSubscriber subscriber = new RecordingSubscriber("client");
        hub.subscribe(jobId, subscriber);

        runScheduled();

        GenerationJob job = jobRegistry.get(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCategory()).isEqualTo(ErrorCategory.GENERATION_FAILURE);
        assertThat(job.getError()).contains("model unavailable");
        assertThat(versionStore.listVersions("diagram_x")).isEmpty();
        assertThat(subscriber.types()).endsWith("generation.error");
        assertThat(subscriber.types()).doesNotContain("generation.complete");
    }

    @Test
    void blankContentCountsAsAFailedGeneration() {
        GenerationJobRunner runner = runner(stubGenerator("   "), deferredExecutor);
        String jobId = runner.submit(request("diagram_x"));

        runScheduled();

        assertThat(jobRegistry.get(jobId).orElseThrow().getErrorCategory()).isEqualTo(ErrorCategory.GENERATION_FAILURE);
        assertThat(versionStore.exists("diagram_x")).isFalse();
    }

    @Test
    void storeFailureIsReportedWithItsOwnCategory() {
        VersionStore failingStore = mock(VersionStore.class);
        when(failingStore.append(anyString(), anyString(), anyMap()))
                .thenThrow(new StoreUnavailableException("disk full", null));
        GenerationJobRunner runner = new GenerationJobRunner(jobRegistry, failingStore, hub, stubGenerator("content"),
                validator, deferredExecutor, RateLimiter.create(Double.MAX_VALUE));
        String jobId = runner.submit(request("diagram_x"));

        runScheduled();

        GenerationJob job = jobRegistry.get(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCategory()).isEqualTo(ErrorCategory.STORE_UNAVAILABLE);
        assertThat(job.getResultVersion()).isNull();
    }

    @Test
    void invalidRequestsCreateNoJob() {
        GenerationJobRunner runner = runner(stubGenerator("x"), deferredExecutor);

        assertThatThrownBy(() -> runner.submit(request("Bad-Type"))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> runner.submit(GenerationRequest.builder().artifactType("a").build()))
                .isInstanceOf(ValidationException.class);

        assertThat(jobRegistry.listRecent(10)).isEmpty();
        assertThat(scheduled).isEmpty();
    }

    @Test
    void submissionsBeyondTheRateLimitAreThrottled() {
        GenerationJobRunner runner = new GenerationJobRunner(jobRegistry, versionStore, hub, stubGenerator("x"),
                validator, deferredExecutor, RateLimiter.create(0.001));

        runner.submit(request("a"));

        assertThatThrownBy(() -> runner.submit(request("a"))).isInstanceOf(ThrottledException.class);
        assertThat(jobRegistry.listRecent(10)).hasSize(1);
    }

    @Test
    void bulkSubmissionQueuesOneJobPerItem() {
        GenerationJobRunner runner = runner(stubGenerator("erDiagram", "# API"), deferredExecutor);

        List<BulkGenerationResult> results = runner.submitBulk(List.of(request("mermaid_erd"), request("api_docs")));
        runScheduled();

        assertThat(results).hasSize(2).allSatisfy(result -> {
            assertThat(result.getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(result.getError()).isNull();
        });
        assertThat(jobRegistry.get(results.get(1).getJobId()).orElseThrow().getResultArtifactId()).isEqualTo("api_docs");
        assertThat(versionStore.listArtifactIds()).containsExactly("api_docs", "mermaid_erd");
    }

    @Test
    void bulkSubmissionWithAnInvalidItemQueuesNothing() {
        GenerationJobRunner runner = runner(stubGenerator("x"), deferredExecutor);
        List<GenerationRequest> items = List.of(request("mermaid_erd"), GenerationRequest.builder().artifactType("api_docs").build());

        assertThatThrownBy(() -> runner.submitBulk(items))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("items[1]: ");
        assertThatThrownBy(() -> runner.submitBulk(List.of())).isInstanceOf(ValidationException.class);
        assertThat(jobRegistry.listRecent(10)).isEmpty();
        assertThat(scheduled).isEmpty();
    }

    @Test
    void throttledBulkItemsAreReportedWithoutAJob() {
        GenerationJobRunner runner = new GenerationJobRunner(jobRegistry, versionStore, hub, stubGenerator("x"),
                validator, deferredExecutor, RateLimiter.create(0.001));

        List<BulkGenerationResult> results = runner.submitBulk(List.of(request("a"), request("b")));

        assertThat(results.get(0).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(results.get(1).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(results.get(1).getJobId()).isNull();
        assertThat(results.get(1).getError()).isNotBlank();
        assertThat(jobRegistry.listRecent(10)).hasSize(1);
    }

    @Test
    void observerJoinsBeforeTheJobIsScheduled() {
        RecordingSubscriber observer = new RecordingSubscriber("stream");
        TaskExecutor immediate = Runnable::run;
        GenerationJobRunner runner = runner(stubGenerator("graph TD; A-->B"), immediate);

        String jobId = runner.submit(request("diagram_x"), observer);

        assertThat(observer.types()).containsExactly("connection.established", "job.status", "job.status",
                "generation.progress", "generation.progress", "generation.complete");
        assertThat(observer.received().get(1).getData()).containsEntry("status", "queued");
        assertThat(observer.received().get(0).getData()).containsEntry("room_id", jobId);
    }

    @Test
    void rejectedJobsFailAsSchedulingFailures() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        GenerationJobRunner runner = runner(stubGenerator("x"), saturated);

        String jobId = runner.submit(request("a"));

        GenerationJob job = jobRegistry.get(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorCategory()).isEqualTo(ErrorCategory.SCHEDULING_FAILURE);
        assertThat(versionStore.exists("a")).isFalse();
    }

    @Test
    void workerLogsAreTaggedWithTheJobId() {
        AtomicReference<String> mdcDuringGeneration = new AtomicReference<>();
        ContentGenerator generator = (request, progress) -> {
            mdcDuringGeneration.set(MDC.get(GenerationJobRunner.MDC_JOB_ID));
            return new GeneratedContent("content", "stub-model");
        };
        GenerationJobRunner runner = runner(generator, deferredExecutor);
        String jobId = runner.submit(request("a"));

        runScheduled();

        assertThat(mdcDuringGeneration.get()).isEqualTo(jobId);
        assertThat(MDC.get(GenerationJobRunner.MDC_JOB_ID)).isNull();
    }

    private GenerationJobRunner runner(ContentGenerator generator, TaskExecutor executor) {
        return new GenerationJobRunner(jobRegistry, versionStore, hub, generator, validator, executor,
                RateLimiter.create(Double.MAX_VALUE));
    }

    private void runScheduled() {
        List<Runnable> tasks = new ArrayList<>(scheduled);
        scheduled.clear();
        tasks.forEach(Runnable::run);
    }

    private static ContentGenerator stubGenerator(String... contents) {
        List<String> queue = new ArrayList<>(List.of(contents));
        return (request, progress) -> {
            progress.onProgress(10.0, "Building prompt...");
            progress.onProgress(40.0, "Generating " + request.getArtifactType() + "...");
            return new GeneratedContent(queue.remove(0), "stub-model", Map.of("prompt_chars", 42));
        };
    }

    private static GenerationRequest request(String type) {
        return GenerationRequest.builder()
                .artifactType(type)
                .meetingNotes("Discussed the order service and its database tables.")
                .build();
    }
}
