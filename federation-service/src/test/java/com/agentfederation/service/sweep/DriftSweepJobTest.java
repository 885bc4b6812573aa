package com.agentfederation.service.sweep;

import com.agentfederation.core.drift.DriftCheckResult;
import com.agentfederation.core.drift.DriftDetector;
import com.agentfederation.core.geometry.TrustCategory;
import com.agentfederation.core.geometry.TrustVector;
import com.agentfederation.core.registry.InMemoryRegistryStore;
import com.agentfederation.core.registry.PeerStatus;
import com.agentfederation.core.registry.TrustRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DriftSweepJobTest {

    private static final TrustVector LOCAL = TrustVector.fromScores(Map.of(TrustCategory.SECURITY, 1.0));

    private TrustRegistry registry;
    private ObservedVectorBuffer buffer;
    private DriftSweepJob job;

    private static TrustVector peer(double reliability) {
        return TrustVector.fromScores(Map.of(
            TrustCategory.SECURITY, 0.5,
            TrustCategory.RELIABILITY, reliability));
    }

    @BeforeEach
    void setUp() {
        registry = new TrustRegistry(new InMemoryRegistryStore(), LOCAL);
        buffer = new ObservedVectorBuffer();
        job = new DriftSweepJob(new DriftDetector(registry), registry, buffer, DriftDetector.DRIFT_THRESHOLD);
        registry.registerBot("bot-a", "Alpha", peer(0.65));
        registry.registerBot("bot-b", "Beta", peer(0.65));
    }

    @Test
    @DisplayName("empty buffer → nothing checked")
    void emptyBuffer() {
        assertTrue(job.sweep().isEmpty());
    }

    @Test
    @DisplayName("sweep quarantines drifted peers and ignores unknown ones")
    void sweep() {
        buffer.record("bot-a", peer(0.70));
        buffer.record("bot-b", peer(0.65));
        buffer.record("ghost", peer(0.70));

        List<DriftCheckResult> results = job.sweep();

        assertEquals(2, results.size());
        assertEquals(PeerStatus.QUARANTINED, registry.getBotStatus("bot-a").status());
        assertEquals(PeerStatus.UNKNOWN, registry.getBotStatus("bot-b").status());
        assertNull(registry.getBotStatus("ghost"));
        assertEquals(0, buffer.pending());
    }

    @Test
    @DisplayName("configured threshold applies to every check")
    void threshold() {
        DriftSweepJob lenient = new DriftSweepJob(new DriftDetector(registry), registry, buffer, 0.5);
        buffer.record("bot-a", peer(0.70));

        List<DriftCheckResult> results = lenient.sweep();

        assertEquals(1, results.size());
        assertFalse(results.get(0).drifted());
        assertEquals(0.5, results.get(0).threshold());
    }

    @Test
    @DisplayName("sweep waits for a caller holding the registry monitor")
    void serializesOnRegistry() throws Exception {
        buffer.record("bot-a", peer(0.70));
        CompletableFuture<List<DriftCheckResult>> running;

        synchronized (registry) {
            running = CompletableFuture.supplyAsync(job::sweep);
            Thread.sleep(200);
            assertFalse(running.isDone());
            assertEquals(PeerStatus.UNKNOWN, registry.getBotStatus("bot-a").status());
        }

        assertEquals(1, running.get(5, TimeUnit.SECONDS).size());
        assertEquals(PeerStatus.QUARANTINED, registry.getBotStatus("bot-a").status());
    }
}
