package com.agentfederation.core.registry;

/**
 * Outcome of the registry's coarse drift check.
 *
 * <p>{@code drifted} is a first-class result, not an error: it is true when the
 * overlap moved by more than {@value TrustRegistry#DRIFT_WARNING_THRESHOLD} or fell
 * below the quarantine floor. {@code reason} is null when nothing noteworthy happened.
 */
public record DriftCheck(
    boolean drifted,
    double  oldOverlap,
    double  newOverlap,
    String  reason
) {
    static DriftCheck notRegistered() {
        return new DriftCheck(false, 0.0, 0.0, TrustRegistry.NOT_REGISTERED);
    }
}
