package com.agentfederation.core.drift;

import com.agentfederation.core.exception.FederationException;
import com.agentfederation.core.geometry.TensorOverlap;
import com.agentfederation.core.geometry.TrustVector;
import com.agentfederation.core.registry.PeerRecord;
import com.agentfederation.core.registry.TrustRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * High-precision drift monitor for scheduled sweeps over known peers.
 *
 * <p>Independent of the registry's coarse check ({@value TrustRegistry#DRIFT_WARNING_THRESHOLD}):
 * the default threshold here is {@value #DRIFT_THRESHOLD}, so slow incremental edits
 * to a declared profile are caught long before they would cross the coarse band.
 *
 * <h3>Decision</h3>
 * <p>Drift is declared only when the geometry hash changed <em>and</em>
 * |Δoverlap| exceeds the threshold; resubmitting an identical vector never counts.
 * On drift the peer is quarantined unless it already is, and a {@link DriftEvent}
 * is appended to a ring buffer of the last {@value #EVENT_CAPACITY} events.
 *
 * <p>The registry's stored overlap and hash are the "old" side of every comparison;
 * the detector never rewrites them. Counters and events live in memory only.
 */
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    /** Default overlap change that counts as drift. */
    public static final double DRIFT_THRESHOLD = 0.003;

    /** Events kept in the audit ring buffer. */
    public static final int EVENT_CAPACITY = 100;

    private static final int STATS_RECENT_EVENTS = 10;

    private final TrustRegistry registry;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Deque<DriftEvent> events = new ArrayDeque<>(EVENT_CAPACITY);

    private long checks;
    private long drifts;
    private long quarantines;
    private double totalDelta;
    private double maxDelta;

    public DriftDetector(TrustRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    public DriftDetector(TrustRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DriftCheckResult checkBot(String peerId, TrustVector newVector) {
        return checkBot(peerId, newVector, DRIFT_THRESHOLD);
    }

    /**
     * Compares a peer's fresh vector with the registry's last stored observation.
     * Unknown peers yield a non-drifted result and leave every counter untouched.
     */
    public DriftCheckResult checkBot(String peerId, TrustVector newVector, double threshold) {
        Instant now = clock.instant();
        String newHash = TensorOverlap.geometryHash(newVector);

        PeerRecord record = registry.getBotStatus(peerId);
        if (record == null) {
            return new DriftCheckResult(peerId, false, false, 0.0, 0.0, 0.0, threshold,
                "", newHash, "Bot not registered", now);
        }
        checks++;

        double newOverlap = TensorOverlap.computeOverlap(registry.getLocalGeometry(), newVector).overlap();
        double oldOverlap = record.overlap();
        double delta = Math.abs(newOverlap - oldOverlap);
        boolean geometryChanged = !newHash.equals(record.geometryHash());

        if (!geometryChanged) {
            return new DriftCheckResult(peerId, false, false, oldOverlap, newOverlap, delta, threshold,
                record.geometryHash(), newHash, "No geometry change detected", now);
        }
        if (delta <= threshold) {
            return new DriftCheckResult(peerId, false, false, oldOverlap, newOverlap, delta, threshold,
                record.geometryHash(), newHash,
                String.format(Locale.ROOT, "Geometry changed but within tolerance: Δ=%.6f <= %s", delta, plain(threshold)),
                now);
        }

        drifts++;
        totalDelta += delta;
        maxDelta = Math.max(maxDelta, delta);

        boolean quarantined = false;
        String reason;
        if (!record.quarantined()) {
            registry.quarantineBot(peerId, String.format(Locale.ROOT,
                "High-precision drift detected: Δ=%.6f > %s (overlap %.6f → %.6f)",
                delta, plain(threshold), oldOverlap, newOverlap));
            quarantined = true;
            quarantines++;
            reason = String.format(Locale.ROOT, "Auto-quarantined: drift Δ=%.6f exceeds threshold %s", delta, plain(threshold));
        } else {
            reason = String.format(Locale.ROOT, "Drift detected: Δ=%.6f > %s (already quarantined)", delta, plain(threshold));
        }

        appendEvent(new DriftEvent(peerId, record.displayName(), now, oldOverlap, newOverlap, delta, quarantined, reason));
        log.warn("[Drift] peerId={} delta={} threshold={} oldOverlap={} newOverlap={} quarantined={}",
            peerId, String.format(Locale.ROOT, "%.6f", delta), plain(threshold),
            String.format(Locale.ROOT, "%.6f", oldOverlap), String.format(Locale.ROOT, "%.6f", newOverlap), quarantined);

        return new DriftCheckResult(peerId, true, quarantined, oldOverlap, newOverlap, delta, threshold,
            record.geometryHash(), newHash, reason, now);
    }

    public List<DriftCheckResult> checkBatch(Map<String, TrustVector> vectors) {
        return checkBatch(vectors, DRIFT_THRESHOLD);
    }

    /** Checks each entry in iteration order, registered or not. */
    public List<DriftCheckResult> checkBatch(Map<String, TrustVector> vectors, double threshold) {
        List<DriftCheckResult> results = new ArrayList<>(vectors.size());
        vectors.forEach((peerId, vector) -> results.add(checkBot(peerId, vector, threshold)));
        return results;
    }

    public List<DriftCheckResult> monitorAll(Map<String, TrustVector> vectors) {
        return monitorAll(vectors, DRIFT_THRESHOLD);
    }

    /**
     * Sweeps registered peers in registry order, checking those with a vector in
     * {@code vectors}. Entries for unregistered peers are ignored.
     */
    public List<DriftCheckResult> monitorAll(Map<String, TrustVector> vectors, double threshold) {
        List<DriftCheckResult> results = new ArrayList<>();
        for (PeerRecord record : registry.listBots()) {
            TrustVector vector = vectors.get(record.id());
            if (vector != null) {
                results.add(checkBot(record.id(), vector, threshold));
            }
        }
        return results;
    }

    public DriftStats getStats() {
        List<DriftEvent> all = new ArrayList<>(events);
        List<DriftEvent> recent = all.subList(Math.max(0, all.size() - STATS_RECENT_EVENTS), all.size());
        return new DriftStats(
            checks,
            drifts,
            quarantines,
            drifts > 0 ? totalDelta / drifts : 0.0,
            maxDelta,
            List.copyOf(recent)
        );
    }

    /** @return up to {@code limit} events, most recent first */
    public List<DriftEvent> getRecentEvents(int limit) {
        List<DriftEvent> all = new ArrayList<>(events);
        List<DriftEvent> recent = new ArrayList<>(all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size()));
        Collections.reverse(recent);
        return recent;
    }

    public List<DriftEvent> getRecentEvents() {
        return getRecentEvents(STATS_RECENT_EVENTS);
    }

    /** Clears counters and the event log. */
    public void reset() {
        checks = 0;
        drifts = 0;
        quarantines = 0;
        totalDelta = 0;
        maxDelta = 0;
        events.clear();
        log.info("[Drift] Statistics reset");
    }

    /**
     * Serializes the full event log and current statistics for audit export.
     *
     * @return pretty-printed JSON {@code {exported, stats, events}}
     */
    public String exportEvents() {
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("exported", clock.instant());
        export.put("stats", getStats());
        export.put("events", new ArrayList<>(events));
        try {
            return mapper.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new FederationException("Drift", "Unable to export drift events", e);
        }
    }

    private void appendEvent(DriftEvent event) {
        if (events.size() == EVENT_CAPACITY) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
