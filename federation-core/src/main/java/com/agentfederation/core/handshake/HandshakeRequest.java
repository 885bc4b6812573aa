package com.agentfederation.core.handshake;

import com.agentfederation.core.geometry.TrustVector;

import java.time.Instant;

/**
 * Inbound request from a remote peer asking to federate.
 *
 * <p>The vector is the remote peer's self-attested trust profile. How the request
 * travels between processes is up to the caller.
 */
public record HandshakeRequest(
    String      peerId,
    String      displayName,
    TrustVector vector,
    Instant     timestamp,
    String      version
) {
    public static HandshakeRequest of(String peerId, String displayName, TrustVector vector, Instant timestamp) {
        return new HandshakeRequest(peerId, displayName, vector, timestamp, FederationHandshake.PROTOCOL_VERSION);
    }
}
