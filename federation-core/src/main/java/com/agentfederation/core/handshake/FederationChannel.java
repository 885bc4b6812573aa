package com.agentfederation.core.handshake;

import com.agentfederation.core.registry.PeerStatus;

import java.time.Instant;

/**
 * In-memory record of an accepted trust relationship with one remote peer.
 * Exists only while the peer is registered and not quarantined.
 */
public record FederationChannel(
    String     localPeerId,
    String     remotePeerId,
    String     remoteDisplayName,
    double     overlap,
    PeerStatus status,
    Instant    openedAt,
    Instant    lastSeen
) {

    FederationChannel refresh(double newOverlap, PeerStatus newStatus, Instant seen) {
        return new FederationChannel(localPeerId, remotePeerId, remoteDisplayName,
            newOverlap, newStatus, openedAt, seen);
    }
}
