package com.agentfederation.service.sweep;

import com.agentfederation.core.geometry.TrustVector;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest trust vector reported by each remote peer since the previous drift sweep.
 *
 * <p>This is the intake point for fresh peer vectors. The service ships no transport,
 * so whatever component receives peer heartbeats (an HTTP handler, a message listener)
 * calls {@link #record} from any thread; until one does, every sweep finds the buffer
 * empty. A newer report for the same peer replaces the older one.
 * {@link DriftSweepJob} drains the buffer on every run.
 */
@Component
public class ObservedVectorBuffer {

    private final ConcurrentHashMap<String, TrustVector> latest = new ConcurrentHashMap<>();

    public void record(String peerId, TrustVector vector) {
        latest.put(Objects.requireNonNull(peerId, "peerId"), Objects.requireNonNull(vector, "vector"));
    }

    /**
     * Removes and returns every pending observation. An observation recorded while
     * draining lands either in this batch or the next, never in neither.
     */
    public Map<String, TrustVector> drain() {
        Map<String, TrustVector> drained = new LinkedHashMap<>();
        for (String peerId : latest.keySet()) {
            TrustVector vector = latest.remove(peerId);
            if (vector != null) {
                drained.put(peerId, vector);
            }
        }
        return drained;
    }

    public int pending() {
        return latest.size();
    }
}
