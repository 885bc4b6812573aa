package com.agentfederation.core.handshake;

import com.agentfederation.core.geometry.TrustCategory;
import com.agentfederation.core.registry.PeerStatus;

import java.time.Instant;
import java.util.Set;

/**
 * Accept/reject decision for a {@link HandshakeRequest}.
 *
 * <p>A rejection is an ordinary response with {@code accepted=false}; the
 * {@code message} embeds the deciding comparison, e.g.
 * {@code "Handshake rejected: 0.652 < 0.800"}.
 */
public record HandshakeResponse(
    boolean            accepted,
    double             overlap,
    double             threshold,
    Set<TrustCategory> aligned,
    Set<TrustCategory> divergent,
    PeerStatus         status,
    String             message,
    Instant            timestamp
) {}
