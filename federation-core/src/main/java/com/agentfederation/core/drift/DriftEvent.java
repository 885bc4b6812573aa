package com.agentfederation.core.drift;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit entry written each time the detector declares drift.
 */
public record DriftEvent(
    @JsonProperty("peerId")      String  peerId,
    @JsonProperty("displayName") String  displayName,
    @JsonProperty("timestamp")   Instant timestamp,
    @JsonProperty("oldOverlap")  double  oldOverlap,
    @JsonProperty("newOverlap")  double  newOverlap,
    @JsonProperty("delta")       double  delta,
    @JsonProperty("quarantined") boolean quarantined,
    @JsonProperty("reason")      String  reason
) {}
