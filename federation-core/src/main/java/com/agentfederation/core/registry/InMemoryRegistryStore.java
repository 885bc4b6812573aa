package com.agentfederation.core.registry;

/**
 * Keeps the last saved document in memory. Used for tests and ephemeral instances.
 */
public class InMemoryRegistryStore implements RegistryStore {

    private RegistryDocument document;
    private int saveCount;

    public InMemoryRegistryStore() {}

    public InMemoryRegistryStore(RegistryDocument initial) {
        this.document = initial;
    }

    @Override
    public RegistryDocument load() {
        return document;
    }

    @Override
    public void save(RegistryDocument document) {
        this.document = document;
        saveCount++;
    }

    public RegistryDocument current() {
        return document;
    }

    /** Number of saves since construction. */
    public int saveCount() {
        return saveCount;
    }
}
