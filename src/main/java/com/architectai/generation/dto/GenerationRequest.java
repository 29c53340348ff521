package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /generation/generate}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GenerationRequest {

    @JsonProperty("artifact_type")
    private String artifactType;

    @JsonProperty("meeting_notes")
    private String meetingNotes;

    @JsonProperty("context_id")
    private String contextId;

    @JsonProperty("options")
    private GenerationOptions options;

    public GenerationRequest copy() {
        return toBuilder()
                .options(options != null ? options.toBuilder().build() : null)
                .build();
    }
}
