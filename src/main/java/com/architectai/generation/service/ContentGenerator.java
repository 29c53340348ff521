package com.architectai.generation.service;

import com.architectai.generation.dto.GenerationRequest;

/**
 * Produces artifact content for a validated request. Implementations run on a worker thread and may block.
 */
public interface ContentGenerator {

    /**
     * @param request  validated request
     * @param progress receives intermediate progress (0..100) while the content is produced
     * @return the generated content, never {@code null}
     * @throws GenerationException if no usable content could be produced
     */
    GeneratedContent generate(GenerationRequest request, ProgressListener progress);
}
