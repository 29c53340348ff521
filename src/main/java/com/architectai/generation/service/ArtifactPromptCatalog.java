package com.architectai.generation.service;

import com.architectai.generation.dto.GenerationRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Builds the model prompt for an artifact type. Types without a dedicated instruction get a generic one,
 * so new types work without code changes.
 */
@Component
public class ArtifactPromptCatalog {

    private static final Map<String, String> INSTRUCTIONS = Map.ofEntries(
            Map.entry("mermaid_erd", "Produce a Mermaid erDiagram describing the entities, their attributes and relationships."),
            Map.entry("mermaid_architecture", "Produce a Mermaid flowchart showing the system components and how they communicate."),
            Map.entry("mermaid_sequence", "Produce a Mermaid sequenceDiagram for the main request flow."),
            Map.entry("mermaid_class", "Produce a Mermaid classDiagram of the core domain types."),
            Map.entry("mermaid_state", "Produce a Mermaid stateDiagram-v2 for the main lifecycle."),
            Map.entry("mermaid_flowchart", "Produce a Mermaid flowchart of the described process."),
            Map.entry("html_diagram", "Produce a single self-contained HTML page that visualizes the described system."),
            Map.entry("code_prototype", "Produce a minimal, runnable code prototype implementing the described feature."),
            Map.entry("api_docs", "Produce Markdown API documentation for the endpoints implied by the notes."),
            Map.entry("jira_stories", "Produce user stories with acceptance criteria in Markdown."),
            Map.entry("workflows", "Produce a Markdown description of the workflows, one numbered list per workflow."));

    private static final String PROMPT_TEMPLATE =
            "You are a senior software architect. %s\n" +
                    "\n" +
                    "Rules:\n" +
                    "- Output ONLY the artifact. No commentary before or after it.\n" +
                    "- Base everything on the input below; do not invent unrelated features.\n" +
                    "\n" +
                    "Artifact type: %s\n" +
                    "%s";

    public String instructionFor(String artifactType) {
        return INSTRUCTIONS.getOrDefault(artifactType,
                "Produce the artifact of type '" + artifactType + "' that best captures the input.");
    }

    public boolean hasDedicatedInstruction(String artifactType) {
        return INSTRUCTIONS.containsKey(artifactType);
    }

    public String buildPrompt(GenerationRequest request) {
        StringBuilder input = new StringBuilder();
        if (StringUtils.hasText(request.getMeetingNotes())) {
            input.append("\nMeeting notes:\n<notes>\n").append(request.getMeetingNotes().trim()).append("\n</notes>\n");
        }
        if (StringUtils.hasText(request.getContextId())) {
            input.append("\nContext id: ").append(request.getContextId()).append('\n');
        }
        return String.format(PROMPT_TEMPLATE, instructionFor(request.getArtifactType()), request.getArtifactType(), input);
    }
}
