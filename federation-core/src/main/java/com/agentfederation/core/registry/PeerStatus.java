package com.agentfederation.core.registry;

import com.agentfederation.core.geometry.TensorOverlap;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-peer trust status, driven by the latest overlap with one sticky override.
 *
 * <h3>Transition rules</h3>
 * <ul>
 *   <li>{@link #fromOverlap}: a fresh recompute (registration):
 *       overlap ≥ {@value #TRUSTED_THRESHOLD} → {@link #TRUSTED},
 *       overlap &lt; {@value #QUARANTINE_THRESHOLD} → {@link #QUARANTINED},
 *       otherwise {@link #UNKNOWN}.</li>
 *   <li>{@link #afterRecheck}: a drift recheck of an existing peer: a quarantined
 *       peer stays quarantined, anyone else follows {@link #fromOverlap}.</li>
 * </ul>
 *
 * <p>All threshold comparisons for peer status live here.
 */
public enum PeerStatus {
    @JsonProperty("trusted")     TRUSTED,
    @JsonProperty("unknown")     UNKNOWN,
    @JsonProperty("quarantined") QUARANTINED;

    /** Overlap at or above which a peer is trusted. */
    public static final double TRUSTED_THRESHOLD = TensorOverlap.TRUST_THRESHOLD;

    /** Overlap below which a peer is quarantined automatically. */
    public static final double QUARANTINE_THRESHOLD = 0.6;

    public static PeerStatus fromOverlap(double overlap) {
        if (overlap >= TRUSTED_THRESHOLD) return TRUSTED;
        if (overlap < QUARANTINE_THRESHOLD) return QUARANTINED;
        return UNKNOWN;
    }

    public static PeerStatus afterRecheck(PeerStatus current, double overlap) {
        if (current == QUARANTINED) return QUARANTINED;
        return fromOverlap(overlap);
    }
}
