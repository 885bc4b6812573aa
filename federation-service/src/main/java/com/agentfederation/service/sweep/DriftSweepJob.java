package com.agentfederation.service.sweep;

import com.agentfederation.core.drift.DriftCheckResult;
import com.agentfederation.core.drift.DriftDetector;
import com.agentfederation.core.geometry.TrustVector;
import com.agentfederation.core.registry.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Out-of-band high-precision drift sweep.
 *
 * <p>Each run drains the {@link ObservedVectorBuffer} and hands the observations to
 * {@link DriftDetector#monitorAll}; observations for peers the registry does not
 * know are dropped. The check runs while holding the {@link TrustRegistry} bean's
 * monitor; code that drives the registry or handshake from another thread can
 * serialize with the sweep by synchronizing on the same bean.
 */
@Component
public class DriftSweepJob {

    private static final Logger log = LoggerFactory.getLogger(DriftSweepJob.class);

    private final DriftDetector driftDetector;
    private final TrustRegistry trustRegistry;
    private final ObservedVectorBuffer buffer;
    private final double threshold;

    public DriftSweepJob(DriftDetector driftDetector,
                         TrustRegistry trustRegistry,
                         ObservedVectorBuffer buffer,
                         @Value("${federation.drift.threshold:0.003}") double threshold) {
        this.driftDetector = driftDetector;
        this.trustRegistry = trustRegistry;
        this.buffer        = buffer;
        this.threshold     = threshold;
    }

    @Scheduled(fixedDelayString = "${federation.drift.sweep-interval-ms:60000}",
               initialDelayString = "${federation.drift.initial-delay-ms:60000}")
    public List<DriftCheckResult> sweep() {
        Map<String, TrustVector> observations = buffer.drain();
        if (observations.isEmpty()) {
            log.debug("[Sweep] No observations pending");
            return List.of();
        }

        List<DriftCheckResult> results;
        synchronized (trustRegistry) {
            results = driftDetector.monitorAll(observations, threshold);
        }

        long drifted     = results.stream().filter(DriftCheckResult::drifted).count();
        long quarantined = results.stream().filter(DriftCheckResult::quarantined).count();
        log.info("[Sweep] Completed. observations={} checked={} ignored={} drifted={} quarantined={} threshold={}",
            observations.size(), results.size(), observations.size() - results.size(),
            drifted, quarantined, threshold);
        return results;
    }
}
