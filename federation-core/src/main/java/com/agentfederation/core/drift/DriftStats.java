package com.agentfederation.core.drift;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Running counters of a {@link DriftDetector} since construction or the last reset.
 * {@code recentEvents} holds at most the last ten events, oldest first.
 */
public record DriftStats(
    @JsonProperty("totalChecks")      long             totalChecks,
    @JsonProperty("driftsDetected")   long             driftsDetected,
    @JsonProperty("peersQuarantined") long             peersQuarantined,
    @JsonProperty("averageDelta")     double           averageDelta,
    @JsonProperty("maxDelta")         double           maxDelta,
    @JsonProperty("recentEvents")     List<DriftEvent> recentEvents
) {}
