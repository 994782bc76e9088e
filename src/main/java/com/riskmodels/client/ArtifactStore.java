package com.riskmodels.client;

/**
 * Opaque blob storage for model artifacts. Handles are meaningful only to the store.
 */
public interface ArtifactStore {

    String put(byte[] content);

    byte[] get(String handle);

    /** Removes a blob; unknown handles are ignored. */
    void delete(String handle);
}
