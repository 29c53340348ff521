package com.architectai.generation.client;

import com.architectai.generation.dto.GenerateResponse;
import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.GenerationJob;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Java client for the generation HTTP API: submit a job, follow it, fetch the resulting artifact.
 */
public class GenerationApiClient {

    private final RestClient restClient;

    public GenerationApiClient(String baseUrl) {
        this(RestClient.builder().baseUrl(baseUrl).build());
    }

    public GenerationApiClient(RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * @return the id of the queued job
     * @throws HttpClientErrorException on a rejected (400) or throttled (429) submission
     */
    public String submit(GenerationRequest request) {
        GenerateResponse response = restClient.post()
                .uri("/generation/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(GenerateResponse.class);
        if (response == null || response.getJobId() == null) {
            throw new IllegalStateException("Server returned no job id");
        }
        return response.getJobId();
    }

    public Optional<GenerationJob> getJob(String jobId) {
        return getOrEmpty("/generation/jobs/{jobId}", GenerationJob.class, jobId);
    }

    public Optional<ArtifactVersion> getArtifact(String artifactId) {
        return getOrEmpty("/generation/artifacts/{artifactId}", ArtifactVersion.class, artifactId);
    }

    /**
     * Submits the request and waits for the job to finish.
     *
     * @return the terminal job, or empty if {@code policy} ran out first
     */
    public Optional<GenerationJob> generateAndWait(GenerationRequest request, PollPolicy policy) {
        String jobId = submit(request);
        return new JobStatusPoller(this::getJob, policy).awaitTerminal(jobId);
    }

    private <T> Optional<T> getOrEmpty(String uri, Class<T> type, Object... variables) {
        try {
            return Optional.ofNullable(restClient.get()
                    .uri(uri, variables)
                    .retrieve()
                    .body(type));
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
