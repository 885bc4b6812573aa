package com.agentfederation.core.registry;

import com.agentfederation.core.geometry.OverlapResult;
import com.agentfederation.core.geometry.TensorOverlap;
import com.agentfederation.core.geometry.TrustVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Persistent table of known peers, their last observed geometry and trust status.
 *
 * <p>Every mutation is mirrored to the {@link RegistryStore} immediately. Overlaps are
 * computed against a local baseline vector; replacing the baseline with
 * {@link #setLocalGeometry} does not touch stored overlaps; each peer picks up the
 * new baseline on its next registration or drift check.
 *
 * <p>Operations never throw for unknown peers; they return {@code null}, {@code false}
 * or a "not registered" result. Store failures are logged and do not abort the
 * operation; an unreadable store at startup yields an empty table.
 *
 * <p>Not thread-safe: callers serialize access to one instance.
 */
public class TrustRegistry {

    private static final Logger log = LoggerFactory.getLogger(TrustRegistry.class);

    /** Overlap change that the coarse drift check reports as significant. */
    public static final double DRIFT_WARNING_THRESHOLD = 0.15;

    static final String NOT_REGISTERED = "Bot not registered";

    public static final String DEFAULT_QUARANTINE_REASON = "Manual quarantine";

    private final RegistryStore store;
    private final Clock clock;
    private final Map<String, PeerRecord> peers = new LinkedHashMap<>();
    private final List<RegistryListener> listeners = new ArrayList<>();
    private TrustVector localGeometry;

    public TrustRegistry(RegistryStore store, TrustVector localGeometry) {
        this(store, localGeometry, Clock.systemUTC());
    }

    public TrustRegistry(RegistryStore store, TrustVector localGeometry, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.localGeometry = Objects.requireNonNull(localGeometry, "localGeometry");
        this.clock = Objects.requireNonNull(clock, "clock");
        load();
    }

    // ── registration ──────────────────────────────────────────────────────

    /**
     * Registers a new peer or refreshes an existing one.
     *
     * <p>Status is recomputed from scratch, so re-registration is the explicit way
     * to lift an earlier quarantine. {@code registeredAt} is preserved.
     *
     * @return the stored record
     */
    public PeerRecord registerBot(String id, String displayName, TrustVector vector) {
        OverlapResult result = TensorOverlap.computeOverlap(localGeometry, vector);
        double overlap = result.overlap();
        PeerStatus status = PeerStatus.fromOverlap(overlap);
        Instant now = clock.instant();

        PeerRecord existing = peers.get(id);
        String reason = status == PeerStatus.QUARANTINED
            ? String.format(Locale.ROOT, "Low overlap: %.3f < %.1f", overlap, PeerStatus.QUARANTINE_THRESHOLD)
            : null;

        PeerRecord record = new PeerRecord(
            id,
            displayName,
            now,
            TensorOverlap.geometryHash(vector),
            overlap,
            status,
            reason,
            existing != null ? existing.registeredAt() : now
        );
        peers.put(id, record);
        persist();

        log.info("[Registry] Registered. id={} name={} overlap={} status={} new={}",
            id, displayName, fmt(overlap), status, existing == null);
        if (status == PeerStatus.QUARANTINED) {
            notifyQuarantined(record);
        }
        return record;
    }

    // ── reads ─────────────────────────────────────────────────────────────

    /** @return the peer's record, or {@code null} if the id is unknown */
    public PeerRecord getBotStatus(String id) {
        return peers.get(id);
    }

    public List<PeerRecord> listBots() {
        return new ArrayList<>(peers.values());
    }

    public RegistryStats getStats() {
        int trusted = 0, quarantined = 0, unknown = 0;
        for (PeerRecord record : peers.values()) {
            switch (record.status()) {
                case TRUSTED     -> trusted++;
                case QUARANTINED -> quarantined++;
                case UNKNOWN     -> unknown++;
            }
        }
        return new RegistryStats(peers.size(), trusted, quarantined, unknown);
    }

    /** Read-only view of the current local baseline. */
    public TrustVector getLocalGeometry() {
        return localGeometry;
    }

    // ── mutations ─────────────────────────────────────────────────────────

    /**
     * Quarantines a peer unconditionally, whatever its current overlap.
     * A null or blank reason is recorded as {@value #DEFAULT_QUARANTINE_REASON}.
     *
     * @return {@code false} if the id is unknown
     */
    public boolean quarantineBot(String id, String reason) {
        PeerRecord record = peers.get(id);
        if (record == null) {
            log.debug("[Registry] Quarantine skipped, unknown peer. id={}", id);
            return false;
        }
        if (reason == null || reason.isBlank()) {
            reason = DEFAULT_QUARANTINE_REASON;
        }
        PeerRecord updated = record.quarantine(reason, clock.instant());
        peers.put(id, updated);
        persist();

        log.warn("[Registry] Quarantined. id={} previousStatus={} reason={}", id, record.status(), reason);
        notifyQuarantined(updated);
        return true;
    }

    /**
     * Coarse drift check against a peer's freshly reported vector.
     *
     * <p>Reports drift when the overlap moved by more than
     * {@value #DRIFT_WARNING_THRESHOLD} or fell below
     * {@value PeerStatus#QUARANTINE_THRESHOLD}; in the latter case a peer that is not
     * yet quarantined gets quarantined. The stored hash, overlap and lastSeen are
     * refreshed whatever the outcome. A quarantined peer is never promoted here.
     */
    public DriftCheck checkDrift(String id, TrustVector newVector) {
        PeerRecord record = peers.get(id);
        if (record == null) {
            return DriftCheck.notRegistered();
        }

        double newOverlap = TensorOverlap.computeOverlap(localGeometry, newVector).overlap();
        double oldOverlap = record.overlap();
        double delta = Math.abs(newOverlap - oldOverlap);
        boolean belowFloor = newOverlap < PeerStatus.QUARANTINE_THRESHOLD;
        boolean autoQuarantine = belowFloor && !record.quarantined();

        PeerStatus nextStatus = autoQuarantine
            ? record.status()
            : PeerStatus.afterRecheck(record.status(), newOverlap);
        peers.put(id, record.observe(TensorOverlap.geometryHash(newVector), newOverlap, nextStatus, clock.instant()));
        persist();

        boolean drifted = false;
        String reason = null;
        if (autoQuarantine) {
            quarantineBot(id, String.format(Locale.ROOT,
                "Drift detected: overlap dropped from %.3f to %.3f < %.1f",
                oldOverlap, newOverlap, PeerStatus.QUARANTINE_THRESHOLD));
            drifted = true;
            reason = "Auto-quarantined due to low overlap: " + fmt(newOverlap);
        } else if (delta > DRIFT_WARNING_THRESHOLD) {
            drifted = true;
            reason = "Significant overlap change: " + fmt(oldOverlap) + " → " + fmt(newOverlap);
        } else if (belowFloor) {
            drifted = true;
            reason = String.format(Locale.ROOT, "Overlap %.3f < %.1f (already quarantined)",
                newOverlap, PeerStatus.QUARANTINE_THRESHOLD);
        }

        if (drifted) {
            log.info("[Registry] Drift. id={} oldOverlap={} newOverlap={} reason={}",
                id, fmt(oldOverlap), fmt(newOverlap), reason);
        } else {
            log.debug("[Registry] No drift. id={} oldOverlap={} newOverlap={}", id, fmt(oldOverlap), fmt(newOverlap));
        }
        return new DriftCheck(drifted, oldOverlap, newOverlap, reason);
    }

    /** @return {@code false} if the id is unknown */
    public boolean removeBot(String id) {
        if (peers.remove(id) == null) {
            return false;
        }
        persist();
        log.info("[Registry] Removed. id={}", id);
        for (RegistryListener listener : List.copyOf(listeners)) {
            listener.onRemoved(id);
        }
        return true;
    }

    /**
     * Replaces the local baseline. Stored overlaps are left as they are until each
     * peer's next recompute.
     */
    public void setLocalGeometry(TrustVector geometry) {
        this.localGeometry = Objects.requireNonNull(geometry, "geometry");
        log.info("[Registry] Local geometry replaced. hash={} peersWithStaleOverlap={}",
            TensorOverlap.geometryHash(geometry), peers.size());
    }

    public void addListener(RegistryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    // ── persistence ───────────────────────────────────────────────────────

    private void load() {
        RegistryDocument document;
        try {
            document = store.load();
        } catch (IOException e) {
            log.warn("[Registry] Stored registry unreadable, starting empty (non-fatal). reason={}", e.getMessage());
            return;
        }
        if (document == null) {
            log.info("[Registry] No stored registry, starting empty");
            return;
        }
        for (PeerRecord record : document.bots()) {
            if (record == null || record.id() == null || record.status() == null) {
                log.warn("[Registry] Skipping malformed stored entry. entry={}", record);
                continue;
            }
            peers.put(record.id(), record);
        }
        log.info("[Registry] Loaded. peers={} version={} lastUpdated={}",
            peers.size(), document.version(), document.lastUpdated());
    }

    private void persist() {
        RegistryDocument document = new RegistryDocument(
            new ArrayList<>(peers.values()), RegistryDocument.FORMAT_VERSION, clock.instant());
        try {
            store.save(document);
        } catch (IOException e) {
            log.error("[Registry] Failed to save registry (non-fatal). peers={}", peers.size(), e);
        }
    }

    private void notifyQuarantined(PeerRecord record) {
        for (RegistryListener listener : List.copyOf(listeners)) {
            listener.onQuarantined(record);
        }
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
