package com.agentfederation.core.drift;

import java.time.Instant;

/**
 * Outcome of one {@link DriftDetector#checkBot} call.
 *
 * <ul>
 *   <li>{@code drifted}: hash changed and |Δoverlap| exceeded {@code threshold}</li>
 *   <li>{@code quarantined}: this check quarantined the peer (false if it already was)</li>
 *   <li>{@code oldHash}: empty when the peer is not registered</li>
 * </ul>
 */
public record DriftCheckResult(
    String  peerId,
    boolean drifted,
    boolean quarantined,
    double  oldOverlap,
    double  newOverlap,
    double  delta,
    double  threshold,
    String  oldHash,
    String  newHash,
    String  reason,
    Instant timestamp
) {}
