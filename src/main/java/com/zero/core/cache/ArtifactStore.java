package com.zero.core.cache;

import com.zero.core.model.Artifact;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for analyzer artifacts keyed by (target, analyzerId).
 * <p>
 * {@link #put} must replace any previous artifact for the key atomically: a reader
 * sees either the old artifact or the new one, never a partial write. Concurrent
 * puts to the same key are last-write-wins.
 */
public interface ArtifactStore {

    Optional<Artifact> get(String target, String analyzerId);

    void put(Artifact artifact);

    /**
     * Writes {@code artifact} unless an OK artifact is already stored for its key.
     * The check and the write happen as one step with respect to other writers.
     *
     * @return true if the artifact was written
     */
    boolean putUnlessOk(Artifact artifact);

    /** @return true if an artifact was removed */
    boolean remove(String target, String analyzerId);

    /** Removes every artifact of {@code target}; returns how many were removed. */
    int removeAll(String target);

    List<Artifact> list(String target);

    /** Short description for health output, e.g. "filesystem:/var/zero". */
    String describe();
}
