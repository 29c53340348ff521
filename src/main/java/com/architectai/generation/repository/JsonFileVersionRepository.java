package com.architectai.generation.repository;

import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.service.StoreUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Stores each artifact's history as a JSON array in {@code <dir>/<artifactId>.json}.
 *
 * Writes go to a temp file in the same directory and are moved over the target, so a crash
 * leaves either the previous or the new history on disk.
 */
@Repository
public class JsonFileVersionRepository implements VersionRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileVersionRepository.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public JsonFileVersionRepository(ObjectMapper objectMapper,
                                     @Value("${app.versions.dir:data/versions}") String directory) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.writer = this.objectMapper.writerWithDefaultPrettyPrinter();
        logger.info("Version files are stored under {}", this.directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public List<String> listCollectionIds() {
        if (!Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    String name = file.getFileName().toString();
                    ids.add(name.substring(0, name.length() - SUFFIX.length()));
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to list version files in " + directory, e);
        }
        Collections.sort(ids);
        return ids;
    }

    @Override
    public boolean exists(String collectionId) {
        return Files.isRegularFile(resolve(collectionId));
    }

    @Override
    public Optional<List<ArtifactVersion>> load(String collectionId) {
        Path file = resolve(collectionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (root == null || root.isNull() || root.isMissingNode()) {
                return Optional.of(new ArrayList<>());
            }
            if (!root.isArray()) {
                throw new StoreUnavailableException("Version file " + file + " does not hold a JSON array", null);
            }
            List<ArtifactVersion> versions = new ArrayList<>(root.size());
            for (JsonNode node : root) {
                if (node.isObject()) {
                    versions.add(toVersion((ObjectNode) node.deepCopy()));
                }
            }
            return Optional.of(versions);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read version file " + file, e);
        }
    }

    @Override
    public void save(String collectionId, List<ArtifactVersion> versions) {
        Path target = resolve(collectionId);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, collectionId + "-", ".tmp");
            Files.writeString(temp, writer.writeValueAsString(versions), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
            logger.debug("Persisted {} versions to {}", versions.size(), target);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write version file " + target, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupError) {
                    logger.warn("Could not remove temp file {}: {}", temp, cleanupError.getMessage());
                }
            }
        }
    }

    @Override
    public void delete(String collectionId) {
        Path file = resolve(collectionId);
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Deleted version file {}", file);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete version file " + file, e);
        }
    }

    private Path resolve(String collectionId) {
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("Collection id must not be blank");
        }
        Path file = directory.resolve(collectionId + SUFFIX).normalize();
        if (!directory.equals(file.getParent())) {
            throw new IllegalArgumentException("Collection id escapes the version directory: " + collectionId);
        }
        return file;
    }

    private ArtifactVersion toVersion(ObjectNode node) throws JsonProcessingException {
        // Older files carry naive ISO timestamps; parse created_at by hand and treat those as UTC.
        JsonNode createdAt = node.remove("created_at");
        ArtifactVersion version = objectMapper.treeToValue(node, ArtifactVersion.class);
        version.setCreatedAt(parseTimestamp(createdAt));
        return version;
    }

    static OffsetDateTime parseTimestamp(JsonNode value) {
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        String text = value.asText().trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.warn("Unparseable created_at '{}' in version record; treating as missing", text);
            return null;
        }
    }
}
