package com.agentfederation.core.registry;

/**
 * Peer counts by status.
 */
public record RegistryStats(
    int total,
    int trusted,
    int quarantined,
    int unknown
) {}
