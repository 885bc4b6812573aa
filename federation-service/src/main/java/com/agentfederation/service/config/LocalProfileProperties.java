package com.agentfederation.service.config;

import com.agentfederation.core.geometry.TrustVector;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Identity and trust profile of this federation instance.
 *
 * <p>{@code vector} maps category keys ({@code security}, {@code code-quality}, ...) to
 * scores in [0,1]; categories left out score 0. The profile itself is produced
 * upstream and only copied into configuration here.
 */
@ConfigurationProperties("federation.local")
public record LocalProfileProperties(
    String              peerId,
    String              displayName,
    Map<String, Double> vector
) {

    public TrustVector toVector() {
        return vector == null ? TrustVector.zero() : TrustVector.fromNamedScores(vector);
    }
}
