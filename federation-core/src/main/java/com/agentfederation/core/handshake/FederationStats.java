package com.agentfederation.core.handshake;

/**
 * Snapshot of open channels and registry population.
 */
public record FederationStats(
    int activeChannels,
    int registeredBots,
    int trusted,
    int quarantined,
    int unknown
) {}
