package com.architectai.generation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Size and similarity summary of two versions of the same artifact.
 */
@Getter
@AllArgsConstructor
public class VersionComparison {

    @JsonProperty("artifact_id")
    private final String artifactId;

    @JsonProperty("version1")
    private final Side version1;

    @JsonProperty("version2")
    private final Side version2;

    @JsonProperty("differences")
    private final Differences differences;

    @Getter
    @AllArgsConstructor
    public static class Side {
        @JsonProperty("version")
        private final int version;
        @JsonProperty("created_at")
        private final OffsetDateTime createdAt;
        @JsonProperty("size")
        private final int size;
        @JsonProperty("lines")
        private final int lines;
    }

    @Getter
    @AllArgsConstructor
    public static class Differences {
        @JsonProperty("size_diff")
        private final int sizeDiff;
        @JsonProperty("lines_diff")
        private final int linesDiff;
        @JsonProperty("similarity")
        private final double similarity;
    }
}
