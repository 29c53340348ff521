package com.architectai.generation.repository;

import com.architectai.generation.model.ArtifactVersion;

import java.util.List;
import java.util.Optional;

/**
 * Durable backing medium for version histories: one record collection per artifact id.
 */
public interface VersionRepository {

    /**
     * Ids of every persisted collection, stable and legacy alike.
     */
    List<String> listCollectionIds();

    boolean exists(String collectionId);

    /**
     * Loads the records of a collection in stored order.
     *
     * @throws com.architectai.generation.service.StoreUnavailableException if the collection exists but cannot be read
     */
    Optional<List<ArtifactVersion>> load(String collectionId);

    /**
     * Replaces the whole collection; readers see either the old or the new content, never a mix.
     *
     * @throws com.architectai.generation.service.StoreUnavailableException if the write fails
     */
    void save(String collectionId, List<ArtifactVersion> versions);

    /**
     * Removes a collection; a missing collection is not an error.
     */
    void delete(String collectionId);
}
