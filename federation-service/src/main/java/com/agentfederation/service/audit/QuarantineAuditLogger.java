package com.agentfederation.service.audit;

import com.agentfederation.core.registry.PeerRecord;
import com.agentfederation.core.registry.RegistryListener;
import com.agentfederation.core.registry.TrustRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Writes one audit line per quarantine or removal, whichever component caused it
 * (handshake, coarse drift check, drift sweep or a manual call).
 */
@Component
public class QuarantineAuditLogger implements RegistryListener {

    private static final Logger log = LoggerFactory.getLogger(QuarantineAuditLogger.class);

    private final TrustRegistry trustRegistry;

    public QuarantineAuditLogger(TrustRegistry trustRegistry) {
        this.trustRegistry = trustRegistry;
    }

    @PostConstruct
    public void register() {
        trustRegistry.addListener(this);
    }

    @Override
    public void onQuarantined(PeerRecord record) {
        log.warn("PEER_QUARANTINED id={} name={} overlap={} reason={}",
            record.id(), record.displayName(), String.format(Locale.ROOT, "%.3f", record.overlap()),
            record.quarantineReason());
    }

    @Override
    public void onRemoved(String peerId) {
        log.info("PEER_REMOVED id={}", peerId);
    }
}
