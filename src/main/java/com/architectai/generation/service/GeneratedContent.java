package com.architectai.generation.service;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a {@link ContentGenerator}: the artifact body plus whatever the generator wants recorded
 * in the version metadata.
 */
@Getter
public class GeneratedContent {

    private final String content;
    private final String modelUsed;
    private final Map<String, Object> metadata;

    public GeneratedContent(String content, String modelUsed, Map<String, Object> metadata) {
        this.content = content;
        this.modelUsed = modelUsed;
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public GeneratedContent(String content, String modelUsed) {
        this(content, modelUsed, null);
    }
}
