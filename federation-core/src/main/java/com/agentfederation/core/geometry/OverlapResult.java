package com.agentfederation.core.geometry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Output of {@link TensorOverlap#computeOverlap}.
 *
 * <ul>
 *   <li>{@code overlap}: cosine magnitude in [0,1]</li>
 *   <li>{@code aligned}: categories whose scores differ by at most 0.2</li>
 *   <li>{@code divergent}: categories whose scores differ by more than 0.4</li>
 * </ul>
 *
 * <p>A category whose difference falls in (0.2, 0.4] is in neither set; see
 * {@link #neutral()}. Sets iterate in category order.
 */
public record OverlapResult(
    double             overlap,
    Set<TrustCategory> aligned,
    Set<TrustCategory> divergent
) {

    public OverlapResult {
        aligned   = Collections.unmodifiableSet(copyOf(aligned));
        divergent = Collections.unmodifiableSet(copyOf(divergent));
    }

    /** Categories that are neither aligned nor divergent. */
    public Set<TrustCategory> neutral() {
        EnumSet<TrustCategory> neutral = EnumSet.allOf(TrustCategory.class);
        neutral.removeAll(aligned);
        neutral.removeAll(divergent);
        return Collections.unmodifiableSet(neutral);
    }

    private static EnumSet<TrustCategory> copyOf(Set<TrustCategory> categories) {
        return categories == null || categories.isEmpty()
            ? EnumSet.noneOf(TrustCategory.class)
            : EnumSet.copyOf(categories);
    }
}
