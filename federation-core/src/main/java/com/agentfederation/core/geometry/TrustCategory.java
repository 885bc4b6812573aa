package com.agentfederation.core.geometry;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of behavioral categories a trust vector scores, in canonical order.
 *
 * <p>The ordinal is the vector index: {@link #SECURITY} is component 0,
 * {@link #ETHICAL_ALIGNMENT} component 19. Never reorder these constants, since the
 * geometry hash of every stored peer depends on the order.
 */
public enum TrustCategory {
    SECURITY,
    RELIABILITY,
    DATA_INTEGRITY,
    PROCESS_ADHERENCE,
    CODE_QUALITY,
    TESTING,
    DOCUMENTATION,
    COMMUNICATION,
    TIME_MANAGEMENT,
    RESOURCE_EFFICIENCY,
    RISK_ASSESSMENT,
    COMPLIANCE,
    INNOVATION,
    COLLABORATION,
    ACCOUNTABILITY,
    TRANSPARENCY,
    ADAPTABILITY,
    DOMAIN_EXPERTISE,
    USER_FOCUS,
    ETHICAL_ALIGNMENT;

    /** Number of dimensions in every trust vector. */
    public static final int DIMENSIONS = values().length;

    /** Wire key, e.g. {@code "code_quality"}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lookup by wire key. Case, underscores and hyphens are ignored, so
     * {@code "code_quality"}, {@code "code-quality"} and {@code "codeQuality"} all match.
     *
     * @return the category, or empty if the key names no category
     */
    public static Optional<TrustCategory> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = compact(key);
        for (TrustCategory category : values()) {
            if (compact(category.name()).equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    private static String compact(String key) {
        return key.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
    }
}
