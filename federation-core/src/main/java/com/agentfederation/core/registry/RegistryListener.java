package com.agentfederation.core.registry;

/**
 * Callback for registry changes that other components must react to, such as
 * tearing down a channel once its peer is quarantined.
 *
 * <p>Listeners run synchronously on the mutating thread, after the change is stored.
 */
public interface RegistryListener {

    void onQuarantined(PeerRecord record);

    default void onRemoved(String peerId) {}
}
