package com.architectai.generation.service;

import com.architectai.generation.dto.VersionComparison;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.LegacyArtifactIds;
import com.architectai.generation.repository.VersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Append-only, per-artifact version history with a single current pointer.
 *
 * Every history is cached in memory as an immutable list that is swapped in one step after the
 * durable write succeeded, so readers never observe a half-applied append (two current
 * versions, or none). Appends for the same artifact id are serialized; different ids never
 * contend.
 */
@Service
public class VersionStore {

    private static final Logger logger = LoggerFactory.getLogger(VersionStore.class);
    private static final Pattern ARTIFACT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");

    private final VersionRepository repository;
    private final Clock clock;

    private final ConcurrentHashMap<String, List<ArtifactVersion>> histories = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();
    // Collections that exist on disk but could not be read; appending to them would fork history.
    private final Set<String> unreadable = ConcurrentHashMap.newKeySet();

    public VersionStore(VersionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Rebuilds the in-memory cache from durable state. Legacy timestamp-suffixed collections are
     * left to {@link MigrationReconciler} and are not exposed as artifacts.
     */
    public void reload() {
        List<String> ids = repository.listCollectionIds();
        Set<String> seen = new HashSet<>();
        int loaded = 0;
        for (String id : ids) {
            if (LegacyArtifactIds.isLegacy(id)) {
                continue;
            }
            seen.add(id);
            synchronized (lockFor(id)) {
                try {
                    Optional<List<ArtifactVersion>> stored = repository.load(id);
                    if (stored.isPresent() && !stored.get().isEmpty()) {
                        histories.put(id, normalize(id, stored.get()));
                        loaded++;
                    } else {
                        histories.remove(id);
                    }
                    unreadable.remove(id);
                } catch (StoreUnavailableException e) {
                    logger.error("Version history for {} could not be loaded; appends to it are blocked until it is repaired: {}",
                            id, e.getMessage(), e);
                    histories.remove(id);
                    unreadable.add(id);
                }
            }
        }
        for (String id : new ArrayList<>(histories.keySet())) {
            if (seen.contains(id)) {
                continue;
            }
            synchronized (lockFor(id)) {
                // may have been appended after the directory listing was taken
                if (!repository.exists(id)) {
                    histories.remove(id);
                }
            }
        }
        unreadable.removeIf(id -> !seen.contains(id));
        logger.info("Loaded version histories for {} artifacts ({} unreadable).", loaded, unreadable.size());
    }

    /**
     * Appends the next version of an artifact and makes it the current one.
     *
     * @throws ValidationException       if the artifact id is blank or shaped like a legacy id
     * @throws StoreUnavailableException if the new history could not be persisted; nothing changes then
     */
    public ArtifactVersion append(String artifactId, String content, Map<String, Object> metadata) {
        validateArtifactId(artifactId);
        synchronized (lockFor(artifactId)) {
            if (unreadable.contains(artifactId)) {
                throw new StoreUnavailableException("Version history for " + artifactId + " is unreadable", null);
            }
            List<ArtifactVersion> prior = histories.getOrDefault(artifactId, Collections.emptyList());
            ArtifactVersion last = prior.isEmpty() ? null : prior.get(prior.size() - 1);

            OffsetDateTime createdAt = OffsetDateTime.now(clock);
            if (last != null && last.getCreatedAt() != null && createdAt.isBefore(last.getCreatedAt())) {
                createdAt = last.getCreatedAt();
            }

            ArtifactVersion created = ArtifactVersion.builder()
                    .artifactId(artifactId)
                    .artifactType(last != null && last.getArtifactType() != null ? last.getArtifactType() : artifactId)
                    .version(last == null ? 1 : last.getVersion() + 1)
                    .content(content)
                    .createdAt(createdAt)
                    .current(true)
                    .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                    .build();

            List<ArtifactVersion> updated = new ArrayList<>(prior.size() + 1);
            for (ArtifactVersion version : prior) {
                updated.add(version.isCurrent() ? version.toBuilder().current(false).build() : version);
            }
            updated.add(created);

            repository.save(artifactId, updated);
            histories.put(artifactId, Collections.unmodifiableList(updated));
            logger.info("Created version {} for artifact {}", created.getVersion(), artifactId);
            return created.copy();
        }
    }

    /**
     * Installs a complete history for an artifact that has none yet.
     *
     * @return false if a history for {@code artifactId} already exists (in memory or on disk)
     */
    public boolean importHistory(String artifactId, List<ArtifactVersion> versions) {
        validateArtifactId(artifactId);
        if (versions == null || versions.isEmpty()) {
            throw new ValidationException("Cannot import an empty history for " + artifactId);
        }
        synchronized (lockFor(artifactId)) {
            if (histories.containsKey(artifactId) || unreadable.contains(artifactId) || repository.exists(artifactId)) {
                return false;
            }
            List<ArtifactVersion> history = new ArrayList<>(versions.size());
            for (int i = 0; i < versions.size(); i++) {
                ArtifactVersion source = versions.get(i);
                if (!Objects.equals(source.getVersion(), i + 1) || !artifactId.equals(source.getArtifactId())) {
                    throw new ValidationException("Imported history for " + artifactId + " must be numbered 1.." + versions.size());
                }
                history.add(source.copy().toBuilder().current(i == versions.size() - 1).build());
            }
            repository.save(artifactId, history);
            histories.put(artifactId, Collections.unmodifiableList(history));
            logger.info("Imported {} versions for artifact {}", history.size(), artifactId);
            return true;
        }
    }

    public Optional<ArtifactVersion> getCurrent(String artifactId) {
        List<ArtifactVersion> history = history(artifactId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1).copy());
    }

    public Optional<ArtifactVersion> getVersion(String artifactId, int version) {
        return history(artifactId).stream()
                .filter(v -> v.getVersion() != null && v.getVersion() == version)
                .findFirst()
                .map(ArtifactVersion::copy);
    }

    /**
     * Snapshot of the history in ascending version order; empty if the artifact is unknown.
     */
    public List<ArtifactVersion> listVersions(String artifactId) {
        List<ArtifactVersion> history = history(artifactId);
        List<ArtifactVersion> copies = new ArrayList<>(history.size());
        for (ArtifactVersion version : history) {
            copies.add(version.copy());
        }
        return copies;
    }

    public Set<String> listArtifactIds() {
        return Collections.unmodifiableSet(new TreeSet<>(histories.keySet()));
    }

    public boolean exists(String artifactId) {
        return artifactId != null && histories.containsKey(artifactId);
    }

    /**
     * Compares two versions by size, line count and character-set overlap.
     */
    public Optional<VersionComparison> compare(String artifactId, int first, int second) {
        Optional<ArtifactVersion> left = getVersion(artifactId, first);
        Optional<ArtifactVersion> right = getVersion(artifactId, second);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        String a = Objects.toString(left.get().getContent(), "");
        String b = Objects.toString(right.get().getContent(), "");
        int linesA = a.split("\n", -1).length;
        int linesB = b.split("\n", -1).length;
        return Optional.of(new VersionComparison(
                artifactId,
                new VersionComparison.Side(first, left.get().getCreatedAt(), a.length(), linesA),
                new VersionComparison.Side(second, right.get().getCreatedAt(), b.length(), linesB),
                new VersionComparison.Differences(b.length() - a.length(), linesB - linesA, similarity(a, b))));
    }

    /**
     * Appends a new version carrying the content of an older one; history is never rewritten.
     */
    public Optional<ArtifactVersion> restore(String artifactId, int version) {
        Optional<ArtifactVersion> source = getVersion(artifactId, version);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>(source.get().getMetadata());
        metadata.put("restored_from", version);
        metadata.put("restored_at", OffsetDateTime.now(clock).toString());
        ArtifactVersion restored = append(artifactId, source.get().getContent(), metadata);
        logger.info("Restored version {} of artifact {} as version {}", version, artifactId, restored.getVersion());
        return Optional.of(restored);
    }

    static void validateArtifactId(String artifactId) {
        if (artifactId == null || artifactId.isBlank()) {
            throw new ValidationException("artifact_id is required");
        }
        if (!ARTIFACT_ID.matcher(artifactId).matches()) {
            throw new ValidationException("Invalid artifact_id: " + artifactId);
        }
        if (LegacyArtifactIds.isLegacy(artifactId)) {
            throw new ValidationException("artifact_id " + artifactId + " uses the legacy timestamped form");
        }
    }

    static double similarity(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<Integer> left = new HashSet<>();
        a.codePoints().forEach(left::add);
        Set<Integer> right = new HashSet<>();
        b.codePoints().forEach(right::add);
        Set<Integer> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return union.isEmpty() ? 0.0 : (double) left.size() / union.size();
    }

    private List<ArtifactVersion> history(String artifactId) {
        if (artifactId == null) {
            return Collections.emptyList();
        }
        return histories.getOrDefault(artifactId, Collections.emptyList());
    }

    private Object lockFor(String artifactId) {
        return locks.computeIfAbsent(artifactId, id -> new Object());
    }

    private List<ArtifactVersion> normalize(String artifactId, List<ArtifactVersion> stored) {
        List<ArtifactVersion> sorted = new ArrayList<>(stored);
        for (ArtifactVersion version : sorted) {
            if (version.getVersion() == null || version.getVersion() < 1) {
                throw new StoreUnavailableException("Version history for " + artifactId + " has a record without a valid version number", null);
            }
        }
        sorted.sort(Comparator.comparing(ArtifactVersion::getVersion));
        List<ArtifactVersion> normalized = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ArtifactVersion version = sorted.get(i);
            if (i > 0 && version.getVersion().equals(sorted.get(i - 1).getVersion())) {
                throw new StoreUnavailableException("Version history for " + artifactId + " holds version " + version.getVersion() + " twice", null);
            }
            normalized.add(version.copy().toBuilder()
                    .artifactId(artifactId)
                    .current(i == sorted.size() - 1)
                    .build());
        }
        if (!normalized.isEmpty() && normalized.get(0).getVersion() != 1) {
            logger.warn("Version history for {} starts at version {} instead of 1", artifactId, normalized.get(0).getVersion());
        }
        return Collections.unmodifiableList(normalized);
    }
}
