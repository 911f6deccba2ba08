package com.sceneanchor.domain.anchor.repository;

import com.sceneanchor.domain.anchor.model.FingerprintCollection;

import java.util.Optional;

/**
 * Persistence of the fingerprint collection between analysis passes.
 */
public interface FingerprintStore {

    /**
     * Load the previous snapshot.
     *
     * @return the stored collection, or empty when there is none or it cannot be read
     */
    Optional<FingerprintCollection> load();

    /**
     * Replace the stored snapshot wholesale.
     */
    void save(FingerprintCollection collection);
}
