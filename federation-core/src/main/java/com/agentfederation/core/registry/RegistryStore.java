package com.agentfederation.core.registry;

import java.io.IOException;

/**
 * Durable backing store for a {@link TrustRegistry}.
 *
 * <p>Current implementations: {@link JsonFileRegistryStore} (one JSON file per
 * registry) and {@link InMemoryRegistryStore} (ephemeral).
 */
public interface RegistryStore {

    /**
     * Loads the stored document.
     *
     * @return the document, or {@code null} when nothing has been stored yet
     * @throws IOException if the store exists but cannot be read or parsed
     */
    RegistryDocument load() throws IOException;

    /**
     * Replaces the stored document.
     *
     * @throws IOException if the document could not be written
     */
    void save(RegistryDocument document) throws IOException;
}
