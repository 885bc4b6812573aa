package com.agentfederation.service.config;

import com.agentfederation.core.drift.DriftDetector;
import com.agentfederation.core.handshake.FederationHandshake;
import com.agentfederation.core.registry.JsonFileRegistryStore;
import com.agentfederation.core.registry.RegistryStore;
import com.agentfederation.core.registry.TrustRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LocalProfileProperties.class)
public class FederationConfig {

    private static final Logger log = LoggerFactory.getLogger(FederationConfig.class);

    @Value("${federation.registry.data-dir:./data}")
    private String dataDir;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock federationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryStore registryStore(ObjectMapper objectMapper) {
        JsonFileRegistryStore store = new JsonFileRegistryStore(Path.of(dataDir), objectMapper);
        log.info("Registry store configured. file={}", store.file().toAbsolutePath());
        return store;
    }

    @Bean
    public TrustRegistry trustRegistry(RegistryStore registryStore, LocalProfileProperties profile, Clock federationClock) {
        return new TrustRegistry(registryStore, profile.toVector(), federationClock);
    }

    @Bean
    public FederationHandshake federationHandshake(TrustRegistry trustRegistry, LocalProfileProperties profile,
                                                   Clock federationClock) {
        log.info("Federation handshake ready. localPeerId={} displayName={}", profile.peerId(), profile.displayName());
        return new FederationHandshake(profile.peerId(), profile.displayName(), trustRegistry, federationClock);
    }

    @Bean
    public DriftDetector driftDetector(TrustRegistry trustRegistry, Clock federationClock) {
        return new DriftDetector(trustRegistry, federationClock);
    }
}
