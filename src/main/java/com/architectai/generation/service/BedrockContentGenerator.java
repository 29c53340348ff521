package com.architectai.generation.service;

import com.architectai.generation.dto.GenerationOptions;
import com.architectai.generation.dto.GenerationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates artifact content with an Anthropic model on Amazon Bedrock.
 */
@Service
public class BedrockContentGenerator implements ContentGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BedrockContentGenerator.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final ArtifactPromptCatalog promptCatalog;
    private final String bedrockModelId;
    private final int bedrockMaxTokens;
    private final int maxAttempts;
    private final long baseBackoffMs;

    /**
     * @param bedrockClient    shared runtime client, SDK retries disabled
     * @param modelId          default Bedrock model id, overridable per request
     * @param bedrockMaxTokens default completion budget
     * @param maxAttempts      attempts per call when Bedrock throttles
     * @param baseBackoffMs    first backoff delay, doubled on every throttled attempt
     */
    public BedrockContentGenerator(BedrockRuntimeClient bedrockClient,
                                   ObjectMapper objectMapper,
                                   ArtifactPromptCatalog promptCatalog,
                                   @Value("${aws.bedrock.modelId:anthropic.claude-3-haiku-20240307-v1:0}") String modelId,
                                   @Value("${app.bedrock.maxTokens:4096}") int bedrockMaxTokens,
                                   @Value("${app.bedrock.maxAttempts:6}") int maxAttempts,
                                   @Value("${app.bedrock.baseBackoffMs:800}") long baseBackoffMs) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.promptCatalog = promptCatalog;
        this.bedrockModelId = modelId;
        this.bedrockMaxTokens = Math.max(128, bedrockMaxTokens);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        logger.info("BedrockContentGenerator initialized with model ID: {}", this.bedrockModelId);
    }

    @Override
    public GeneratedContent generate(GenerationRequest request, ProgressListener progress) {
        GenerationOptions options = request.getOptions();
        String effectiveModelId = options != null && StringUtils.hasText(options.getModelId()) ? options.getModelId() : bedrockModelId;
        int maxTokens = options != null && options.getMaxTokens() != null ? Math.max(64, options.getMaxTokens()) : bedrockMaxTokens;

        progress.onProgress(10.0, "Building prompt...");
        String prompt = promptCatalog.buildPrompt(request);

        progress.onProgress(40.0, "Generating " + request.getArtifactType() + "...");
        logger.info("Invoking model {} for artifact type {}", effectiveModelId, request.getArtifactType());
        String text;
        try {
            InvokeModelResponse response = invokeWithRetry(buildRequest(effectiveModelId, maxTokens, options, prompt));
            text = extractText(response.body().asUtf8String());
        } catch (ThrottledException te) {
            throw new GenerationException("Model " + effectiveModelId + " kept throttling the request", te);
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during generation for model {}: {}", effectiveModelId, detail, e);
            throw new GenerationException("Bedrock API error: " + detail, e);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Bedrock response could not be parsed", e);
        }

        progress.onProgress(80.0, "Validating artifact...");
        String content = stripFences(text);
        if (!StringUtils.hasText(content)) {
            throw new GenerationException("Model " + effectiveModelId + " returned no content");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("prompt_chars", prompt.length());
        metadata.put("max_tokens", maxTokens);
        return new GeneratedContent(content, effectiveModelId, metadata);
    }

    private InvokeModelRequest buildRequest(String modelId, int maxTokens, GenerationOptions options, String prompt)
            throws JsonProcessingException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        if (options != null && options.getTemperature() != null) {
            payload.put("temperature", options.getTemperature());
        }
        ObjectNode userMessage = objectMapper.createObjectNode();
        userMessage.put("role", "user");
        userMessage.put("content", prompt);
        payload.putArray("messages").add(userMessage);

        return InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();
    }

    private String extractText(String responseBody) throws JsonProcessingException {
        JsonNode contentBlock = objectMapper.readTree(responseBody).path("content");
        if (!contentBlock.isArray() || contentBlock.size() == 0) {
            logger.error("Bedrock response does not contain a content block: {}", responseBody);
            throw new GenerationException("Bedrock response missing content block");
        }
        return contentBlock.get(0).path("text").asText("");
    }

    /**
     * Removes a surrounding markdown code fence (with or without a language tag) from model output.
     */
    static String stripFences(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            trimmed = firstLineEnd < 0 ? trimmed.substring(3) : trimmed.substring(firstLineEnd + 1);
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3);
            }
            trimmed = trimmed.trim();
        }
        return trimmed;
    }

    /**
     * Repeatedly invokes Bedrock with exponential backoff, surfacing throttling as {@link ThrottledException}.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        for (int attempt = 1; ; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = e.statusCode() == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = baseBackoffMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new GenerationException("Interrupted during backoff", ie);
                }
            }
        }
    }
}
