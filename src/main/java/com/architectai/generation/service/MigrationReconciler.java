package com.architectai.generation.service;

import com.architectai.generation.dto.MigrationPreview;
import com.architectai.generation.dto.MigrationReport;
import com.architectai.generation.model.ArtifactVersion;
import com.architectai.generation.model.LegacyArtifactIds;
import com.architectai.generation.model.LegacyVersionFile;
import com.architectai.generation.repository.VersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Folds legacy timestamp-suffixed version files ({@code mermaid_erd_20251209_123456.json}) into
 * one stable history per base type ({@code mermaid_erd.json}), numbered 1..N in chronological order.
 *
 * The consolidated history is always persisted before any legacy file is deleted. A base type that
 * already has a stable history is never rewritten: if that history already carries the group's
 * provenance, a previous run was interrupted after persisting and only the deletes are redone;
 * otherwise the group is skipped and left for an operator.
 */
@Service
public class MigrationReconciler {

    public static final String MIGRATED_FROM = "migrated_from";

    private static final Logger logger = LoggerFactory.getLogger(MigrationReconciler.class);

    private final VersionRepository repository;
    private final VersionStore versionStore;

    public MigrationReconciler(VersionRepository repository, VersionStore versionStore) {
        this.repository = repository;
        this.versionStore = versionStore;
    }

    /**
     * Describes the legacy groups a run would consolidate, without changing anything.
     */
    public MigrationPreview preview() {
        List<String> ids = repository.listCollectionIds();
        Map<String, List<LegacyVersionFile>> groups = classify(ids);

        Map<String, MigrationPreview.LegacyGroup> legacyGroups = new TreeMap<>();
        for (Map.Entry<String, List<LegacyVersionFile>> entry : groups.entrySet()) {
            List<MigrationPreview.ArtifactCount> artifacts = new ArrayList<>();
            int total = 0;
            for (LegacyVersionFile file : entry.getValue()) {
                List<ArtifactVersion> records = repository.load(file.getLegacyId()).orElse(List.of());
                OffsetDateTime firstCreated = records.isEmpty() ? null : records.get(0).getCreatedAt();
                artifacts.add(new MigrationPreview.ArtifactCount(file.getLegacyId(), records.size(), firstCreated));
                total += records.size();
            }
            legacyGroups.put(entry.getKey(), new MigrationPreview.LegacyGroup(artifacts, total, stableExists(entry.getKey())));
        }

        List<MigrationPreview.ArtifactCount> stable = ids.stream()
                .filter(id -> !LegacyArtifactIds.isLegacy(id))
                .map(id -> new MigrationPreview.ArtifactCount(id, versionStore.listVersions(id).size(), null))
                .collect(Collectors.toList());
        return new MigrationPreview(legacyGroups, stable);
    }

    /**
     * Migrates every legacy group. Safe to call repeatedly; once no legacy files remain it does nothing.
     */
    public synchronized MigrationReport reconcile() {
        List<String> ids = repository.listCollectionIds();
        Map<String, List<LegacyVersionFile>> groups = classify(ids);
        int stableCount = (int) ids.stream().filter(id -> !LegacyArtifactIds.isLegacy(id)).count();

        MigrationReport.MigrationReportBuilder report = MigrationReport.builder()
                .legacyGroups(groups.size())
                .stableIdsUnchanged(stableCount);
        if (groups.isEmpty()) {
            logger.debug("No legacy version files to migrate ({} stable artifacts).", stableCount);
            return report.build();
        }

        logger.info("Found {} legacy artifact groups to migrate", groups.size());
        int migratedVersions = 0;
        int consolidated = 0;
        for (Map.Entry<String, List<LegacyVersionFile>> entry : groups.entrySet()) {
            String baseType = entry.getKey();
            List<LegacyVersionFile> files = entry.getValue();
            try {
                if (stableExists(baseType)) {
                    if (alreadyConsolidated(baseType, files)) {
                        deleteLegacyFiles(files);
                        consolidated += files.size();
                        report.completedGroup(baseType);
                        logger.info("Finished interrupted migration of {}: removed {} leftover legacy files", baseType, files.size());
                    } else {
                        report.skippedGroup(baseType);
                        logger.warn("Stable history for {} already exists without provenance from {}; leaving legacy files in place",
                                baseType, files);
                    }
                    continue;
                }

                List<ArtifactVersion> history = consolidate(baseType, files);
                if (history.isEmpty()) {
                    deleteLegacyFiles(files);
                    consolidated += files.size();
                    logger.info("Legacy files for {} held no versions; removed {}", baseType, files);
                    continue;
                }
                if (!versionStore.importHistory(baseType, history)) {
                    report.skippedGroup(baseType);
                    logger.warn("Stable history for {} appeared during migration; leaving legacy files in place", baseType);
                    continue;
                }
                deleteLegacyFiles(files);
                migratedVersions += history.size();
                consolidated += files.size();
                logger.info("Migrated {} legacy artifacts to {} with {} total versions", files.size(), baseType, history.size());
            } catch (StoreUnavailableException | ValidationException e) {
                report.failedGroup(baseType);
                logger.error("Migration of legacy group {} failed; its files are kept: {}", baseType, e.getMessage(), e);
            }
        }

        MigrationReport result = report.migratedVersions(migratedVersions).artifactsConsolidated(consolidated).build();
        logger.info("Migration complete: {} versions migrated, {} legacy artifacts consolidated, {} skipped, {} failed",
                migratedVersions, consolidated, result.getSkippedGroups().size(), result.getFailedGroups().size());
        return result;
    }

    /**
     * Loads a group's records in file order, tags their origin, re-sorts them by creation time and renumbers.
     */
    List<ArtifactVersion> consolidate(String baseType, List<LegacyVersionFile> files) {
        List<ArtifactVersion> all = new ArrayList<>();
        for (LegacyVersionFile file : files) {
            for (ArtifactVersion record : repository.load(file.getLegacyId()).orElse(List.of())) {
                ArtifactVersion tagged = record.copy();
                tagged.getMetadata().put(MIGRATED_FROM, file.getLegacyId());
                all.add(tagged);
            }
        }
        // List.sort is stable: records with equal (or missing) timestamps keep file order.
        all.sort(Comparator.comparing(ArtifactVersion::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        List<ArtifactVersion> renumbered = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) {
            ArtifactVersion record = all.get(i);
            renumbered.add(record.toBuilder()
                    .version(i + 1)
                    .artifactId(baseType)
                    .artifactType(record.getArtifactType() != null ? record.getArtifactType() : baseType)
                    .current(i == all.size() - 1)
                    .build());
        }
        return renumbered;
    }

    static Map<String, List<LegacyVersionFile>> classify(List<String> collectionIds) {
        Map<String, List<LegacyVersionFile>> groups = new TreeMap<>();
        for (String id : collectionIds) {
            Optional<LegacyVersionFile> legacy = LegacyArtifactIds.parse(id);
            legacy.ifPresent(file -> groups.computeIfAbsent(file.getBaseType(), key -> new ArrayList<>()).add(file));
        }
        groups.values().forEach(files -> files.sort(LegacyVersionFile.BY_TIMESTAMP_SUFFIX));
        return groups;
    }

    private boolean stableExists(String baseType) {
        return versionStore.exists(baseType) || repository.exists(baseType);
    }

    private boolean alreadyConsolidated(String baseType, List<LegacyVersionFile> files) {
        List<ArtifactVersion> stable = versionStore.exists(baseType)
                ? versionStore.listVersions(baseType)
                : repository.load(baseType).orElse(List.of());
        Set<Object> provenance = new HashSet<>();
        for (ArtifactVersion version : stable) {
            if (version.getMetadata() != null && version.getMetadata().get(MIGRATED_FROM) != null) {
                provenance.add(version.getMetadata().get(MIGRATED_FROM));
            }
        }
        for (LegacyVersionFile file : files) {
            if (!provenance.contains(file.getLegacyId())
                    && !repository.load(file.getLegacyId()).orElse(List.of()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private void deleteLegacyFiles(List<LegacyVersionFile> files) {
        for (LegacyVersionFile file : files) {
            repository.delete(file.getLegacyId());
        }
    }
}
