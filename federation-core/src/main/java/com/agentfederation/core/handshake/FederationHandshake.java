package com.agentfederation.core.handshake;

import com.agentfederation.core.geometry.OverlapResult;
import com.agentfederation.core.geometry.TensorOverlap;
import com.agentfederation.core.geometry.TrustVector;
import com.agentfederation.core.registry.DriftCheck;
import com.agentfederation.core.registry.PeerRecord;
import com.agentfederation.core.registry.RegistryListener;
import com.agentfederation.core.registry.RegistryStats;
import com.agentfederation.core.registry.TrustRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Session layer that decides whether to federate with a remote peer and keeps the
 * resulting channels.
 *
 * <h3>Channel lifecycle</h3>
 * <pre>
 *   no channel ──handshake, overlap ≥ 0.8──▶ open (trusted)
 *   open (trusted) ──drift, 0.6 ≤ overlap &lt; 0.8──▶ open (unknown)
 *   open ──quarantine (drift &lt; 0.6, detector, manual close) or removal──▶ no channel
 * </pre>
 *
 * <p>Every handshake registers the peer, accepted or not, so rejected attempts
 * leave an audit entry in the registry. The handshake listens to the registry and
 * drops a channel the moment its peer is quarantined or removed, whoever caused it.
 *
 * <p>Not thread-safe; shares the threading contract of its {@link TrustRegistry}.
 */
public class FederationHandshake {

    private static final Logger log = LoggerFactory.getLogger(FederationHandshake.class);

    public static final String PROTOCOL_VERSION = "1.0.0";

    private final String localPeerId;
    private final String localDisplayName;
    private final TrustRegistry registry;
    private final Clock clock;
    private final Map<String, FederationChannel> channels = new LinkedHashMap<>();

    public FederationHandshake(String localPeerId, String localDisplayName, TrustRegistry registry) {
        this(localPeerId, localDisplayName, registry, Clock.systemUTC());
    }

    public FederationHandshake(String localPeerId, String localDisplayName, TrustRegistry registry, Clock clock) {
        this.localPeerId      = Objects.requireNonNull(localPeerId, "localPeerId");
        this.localDisplayName = localDisplayName;
        this.registry         = Objects.requireNonNull(registry, "registry");
        this.clock            = Objects.requireNonNull(clock, "clock");
        registry.addListener(new ChannelPruner());
    }

    /**
     * Evaluates an inbound handshake.
     *
     * <p>Accepted iff overlap ≥ {@value TensorOverlap#TRUST_THRESHOLD}; an accepted
     * handshake opens (or replaces) the peer's channel.
     */
    public HandshakeResponse initiateHandshake(HandshakeRequest request) {
        Objects.requireNonNull(request, "request");
        if (!PROTOCOL_VERSION.equals(request.version())) {
            log.warn("[Handshake] Protocol version mismatch. peerId={} remoteVersion={} localVersion={}",
                request.peerId(), request.version(), PROTOCOL_VERSION);
        }

        OverlapResult result = TensorOverlap.computeOverlap(registry.getLocalGeometry(), request.vector());
        double overlap = result.overlap();
        boolean accepted = overlap >= TensorOverlap.TRUST_THRESHOLD;

        PeerRecord record = registry.registerBot(request.peerId(), request.displayName(), request.vector());

        Instant now = clock.instant();
        Instant seen = request.timestamp() != null ? request.timestamp() : now;
        if (accepted) {
            channels.put(request.peerId(), new FederationChannel(
                localPeerId, request.peerId(), request.displayName(), overlap, record.status(), now, seen));
        } else {
            // a rejected re-handshake leaves a surviving channel with the fresh numbers
            channels.computeIfPresent(request.peerId(),
                (id, channel) -> channel.refresh(overlap, record.status(), seen));
        }

        String message = accepted
            ? String.format(Locale.ROOT, "Handshake accepted: %.3f >= %.3f", overlap, TensorOverlap.TRUST_THRESHOLD)
            : String.format(Locale.ROOT, "Handshake rejected: %.3f < %.3f", overlap, TensorOverlap.TRUST_THRESHOLD);

        log.info("[Handshake] {} peerId={} name={} aligned={} divergent={} status={}",
            message, request.peerId(), request.displayName(),
            result.aligned().size(), result.divergent().size(), record.status());

        return new HandshakeResponse(
            accepted,
            overlap,
            TensorOverlap.TRUST_THRESHOLD,
            result.aligned(),
            result.divergent(),
            record.status(),
            message,
            now
        );
    }

    /**
     * Observes the response a remote peer sent back for our own handshake.
     * Logging only; no local state changes.
     */
    public void receiveHandshake(HandshakeResponse response) {
        if (response == null) return;
        if (response.accepted()) {
            log.info("[Handshake] Remote accepted. overlap={} aligned={} divergent={}",
                String.format(Locale.ROOT, "%.3f", response.overlap()), response.aligned(), response.divergent());
        } else {
            log.info("[Handshake] Remote rejected. message={}", response.message());
        }
    }

    /**
     * Rechecks a peer with a freshly reported vector via the registry's coarse check,
     * then drops or refreshes its channel.
     */
    public DriftCheck checkChannelDrift(String peerId, TrustVector newVector) {
        DriftCheck drift = registry.checkDrift(peerId, newVector);

        FederationChannel channel = channels.get(peerId);
        if (channel != null) {
            PeerRecord record = registry.getBotStatus(peerId);
            if (record == null || record.quarantined()) {
                channels.remove(peerId);
                log.info("[Handshake] Channel closed after drift check. peerId={} reason={}", peerId, drift.reason());
            } else {
                channels.put(peerId, channel.refresh(drift.newOverlap(), record.status(), clock.instant()));
            }
        }
        return drift;
    }

    /** @return the open channel, or {@code null} */
    public FederationChannel getChannel(String peerId) {
        return channels.get(peerId);
    }

    public List<FederationChannel> listChannels() {
        return new ArrayList<>(channels.values());
    }

    /**
     * Tears down a channel and quarantines its peer, whatever the current overlap.
     *
     * @return {@code false} if no channel was open for the peer
     */
    public boolean closeChannel(String peerId, String reason) {
        FederationChannel channel = channels.remove(peerId);
        if (channel == null) {
            return false;
        }
        registry.quarantineBot(peerId, reason);
        log.info("[Handshake] Channel closed manually. peerId={} overlap={} reason={}",
            peerId, String.format(Locale.ROOT, "%.3f", channel.overlap()), reason);
        return true;
    }

    public FederationStats getStats() {
        RegistryStats stats = registry.getStats();
        return new FederationStats(channels.size(), stats.total(), stats.trusted(), stats.quarantined(), stats.unknown());
    }

    public TrustRegistry getRegistry() {
        return registry;
    }

    public String getLocalPeerId() {
        return localPeerId;
    }

    public String getLocalDisplayName() {
        return localDisplayName;
    }

    private final class ChannelPruner implements RegistryListener {

        @Override
        public void onQuarantined(PeerRecord record) {
            if (channels.remove(record.id()) != null) {
                log.info("[Handshake] Channel closed, peer quarantined. peerId={} reason={}",
                    record.id(), record.quarantineReason());
            }
        }

        @Override
        public void onRemoved(String peerId) {
            if (channels.remove(peerId) != null) {
                log.info("[Handshake] Channel closed, peer removed. peerId={}", peerId);
            }
        }
    }
}
