package com.architectai.generation.service;

import com.architectai.generation.TestClock;
import com.architectai.generation.dto.ArtifactUpdateRequest;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.repository.JsonFileVersionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactEditServiceTest {

    @TempDir
    Path tempDir;

    private VersionStore versionStore;
    private ArtifactEditService editService;

    @BeforeEach
    void setUp() {
        TestClock clock = TestClock.at("2026-01-15T10:00:00Z");
        versionStore = new VersionStore(new JsonFileVersionRepository(new ObjectMapper(), tempDir.toString()), clock);
        editService = new ArtifactEditService(versionStore, clock);
    }

    @Test
    void manualEditBecomesTheNewCurrentVersion() {
        versionStore.append("api_docs", "generated", Map.of("job_id", "gen_1"));

        ArtifactVersion edited = editService.applyManualEdit("api_docs",
                new ArtifactUpdateRequest("edited by hand", Map.of("editor", "sam"))).orElseThrow();

        assertThat(edited.getVersion()).isEqualTo(2);
        assertThat(edited.getMetadata())
                .containsEntry("update_type", ArtifactEditService.UPDATE_TYPE_MANUAL_EDIT)
                .containsEntry("editor", "sam");
        assertThat(versionStore.getCurrent("api_docs").orElseThrow().getContent()).isEqualTo("edited by hand");
    }

    @Test
    void clientCannotForgeProvenanceMetadata() {
        versionStore.append("api_docs", "generated", Map.of("job_id", "gen_1"));

        ArtifactVersion edited = editService.applyManualEdit("api_docs", new ArtifactUpdateRequest("edited",
                Map.of(MigrationReconciler.MIGRATED_FROM, "api_docs_20251209_123456", "job_id", "gen_forged", "editor", "sam")))
                .orElseThrow();

        assertThat(edited.getMetadata())
                .doesNotContainKeys(MigrationReconciler.MIGRATED_FROM, "job_id")
                .containsEntry("editor", "sam")
                .containsEntry("update_type", ArtifactEditService.UPDATE_TYPE_MANUAL_EDIT);
    }

    @Test
    void editsNeverCreateAnArtifact() {
        assertThat(editService.applyManualEdit("unknown", new ArtifactUpdateRequest("text", null))).isEmpty();
        assertThat(versionStore.exists("unknown")).isFalse();
    }

    @Test
    void contentIsRequired() {
        versionStore.append("api_docs", "generated", null);

        assertThatThrownBy(() -> editService.applyManualEdit("api_docs", new ArtifactUpdateRequest(" ", null)))
                .isInstanceOf(ValidationException.class);
        assertThat(versionStore.listVersions("api_docs")).hasSize(1);
    }
}
