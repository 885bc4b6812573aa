package com.agentfederation.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted registry entry for one known peer.
 *
 * <p>{@code quarantineReason} is present iff {@code status == QUARANTINED}.
 * {@code registeredAt} is set on first registration and never changes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PeerRecord(
    @JsonProperty("id")               String     id,
    @JsonProperty("name")             String     displayName,
    @JsonProperty("lastSeen")         Instant    lastSeen,
    @JsonProperty("geometryHash")     String     geometryHash,
    @JsonProperty("overlap")          double     overlap,
    @JsonProperty("status")           PeerStatus status,
    @JsonProperty("quarantineReason") String     quarantineReason,
    @JsonProperty("registeredAt")     Instant    registeredAt
) {

    @JsonIgnore
    public boolean quarantined() {
        return status == PeerStatus.QUARANTINED;
    }

    PeerRecord quarantine(String reason, Instant now) {
        return new PeerRecord(id, displayName, now, geometryHash, overlap,
            PeerStatus.QUARANTINED, reason, registeredAt);
    }

    /** Refreshes the observed geometry; the reason survives only while quarantined. */
    PeerRecord observe(String hash, double newOverlap, PeerStatus newStatus, Instant now) {
        String reason = newStatus == PeerStatus.QUARANTINED ? quarantineReason : null;
        return new PeerRecord(id, displayName, now, hash, newOverlap, newStatus, reason, registeredAt);
    }
}
