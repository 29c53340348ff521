package com.architectai.generation.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes pre-migration artifact ids of the form {@code <base_type>_<yyyyMMdd_HHmmss>},
 * e.g. {@code mermaid_erd_20251209_123456}.
 */
public final class LegacyArtifactIds {

    private static final Pattern LEGACY_ID = Pattern.compile("^(.+)_(\\d{8}_\\d{6})$");

    private LegacyArtifactIds() {
    }

    public static boolean isLegacy(String artifactId) {
        return artifactId != null && LEGACY_ID.matcher(artifactId).matches();
    }

    /**
     * Splits a legacy id into base type and timestamp suffix; empty for stable ids.
     */
    public static Optional<LegacyVersionFile> parse(String artifactId) {
        if (artifactId == null) {
            return Optional.empty();
        }
        Matcher matcher = LEGACY_ID.matcher(artifactId);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new LegacyVersionFile(artifactId, matcher.group(1), matcher.group(2)));
    }
}
