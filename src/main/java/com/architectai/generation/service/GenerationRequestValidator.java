package com.architectai.generation.service;

import com.architectai.generation.dto.GenerationRequest;
import com.architectai.generation.model.LegacyArtifactIds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rejects requests that could never produce a version, before a job is created for them.
 */
@Component
public class GenerationRequestValidator {

    private static final Pattern ARTIFACT_TYPE = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final Set<String> allowedTypes;
    private final int minNotesLength;

    public GenerationRequestValidator(@Value("${app.generation.artifact-types:}") List<String> allowedTypes,
                                      @Value("${app.generation.min-notes-length:10}") int minNotesLength) {
        this.allowedTypes = allowedTypes == null ? Set.of() : allowedTypes.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .collect(Collectors.toCollection(TreeSet::new));
        this.minNotesLength = minNotesLength;
    }

    /**
     * @throws ValidationException describing the first rule the request breaks
     */
    public void validate(GenerationRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        String type = request.getArtifactType();
        if (!StringUtils.hasText(type)) {
            throw new ValidationException("artifact_type is required");
        }
        if (!ARTIFACT_TYPE.matcher(type).matches()) {
            throw new ValidationException("Invalid artifact_type '" + type + "': use lowercase letters, digits and underscores");
        }
        if (LegacyArtifactIds.isLegacy(type)) {
            throw new ValidationException("Invalid artifact_type '" + type + "': timestamp suffixes are not allowed");
        }
        if (!allowedTypes.isEmpty() && !allowedTypes.contains(type)) {
            throw new ValidationException("Unsupported artifact_type '" + type + "'. Supported types: " + allowedTypes);
        }

        String notes = request.getMeetingNotes();
        boolean hasNotes = notes != null && notes.strip().length() >= minNotesLength;
        if (notes != null && !notes.isBlank() && !hasNotes) {
            throw new ValidationException("meeting_notes must be at least " + minNotesLength + " characters");
        }
        if (!hasNotes && !StringUtils.hasText(request.getContextId())) {
            throw new ValidationException("Either meeting_notes or context_id is required");
        }
    }
}
