package com.agentfederation.core.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * On-disk shape of the registry: every peer record plus a format version.
 *
 * <p>{@code bots} may contain {@code null} entries when read from a hand-edited file;
 * {@link TrustRegistry} skips them on load.
 */
public record RegistryDocument(
    @JsonProperty("bots")        List<PeerRecord> bots,
    @JsonProperty("version")     String           version,
    @JsonProperty("lastUpdated") Instant          lastUpdated
) {
    public static final String FORMAT_VERSION = "1.0.0";

    public RegistryDocument {
        bots = bots == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bots));
    }

    public static RegistryDocument empty(Instant now) {
        return new RegistryDocument(List.of(), FORMAT_VERSION, now);
    }
}
