package com.eyelevel.uploadengine.registry;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderConfig;
import com.eyelevel.uploadengine.model.ProviderStatus;
import com.eyelevel.uploadengine.selection.LoadCounter;
import com.eyelevel.uploadengine.transport.UploadTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds the configuration of every registered provider and drives its connectivity probes.
 * <p>
 * Probes are synchronous network round-trips. {@link #register}, {@link #reconfigure},
 * {@link #performHealthCheck()} and {@link #recoverProvider} may therefore block and should stay off
 * latency-sensitive paths.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderRegistry {

    private static final Comparator<Registration> FAILOVER_ORDER =
            Comparator.comparingInt((Registration r) -> r.provider().getPriority())
                      .thenComparingLong(Registration::sequence);

    private final ConcurrentMap<String, Registration> registrations = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final UploadTransport transport;
    private final HealthTracker healthTracker;
    private final CostLedger costLedger;
    private final LoadCounter loadCounter;
    private final Clock clock;

    /**
     * Registers a provider with an explicit priority rank.
     *
     * @see #register(Provider)
     */
    public boolean register(final Provider provider, final int priority) {
        return register(provider.toBuilder().priority(priority).build());
    }

    /**
     * Registers a provider, starts tracking it as OFFLINE and probes it once; a successful probe makes it OPTIMAL.
     * A provider whose probe fails stays registered but unavailable.
     *
     * @param provider the provider to add.
     * @return {@code false} if a provider with the same id is already registered.
     */
    public boolean register(final Provider provider) {
        final Registration registration = new Registration(provider, sequence.getAndIncrement());
        if (registrations.putIfAbsent(provider.getId(), registration) != null) {
            log.warn("Provider '{}' is already registered", provider.getId());
            return false;
        }
        healthTracker.track(provider.getId());
        costLedger.open(provider.getId(), provider.getConfig().getCostPerMegabyte());

        log.info("Registered provider '{}' ({}, priority {}, bucket '{}')", provider.getId(), provider.getPlatform(),
                provider.getPriority(), provider.getConfig().getBucketName());
        if (probe(provider)) {
            log.info("Provider '{}' connected successfully", provider.getId());
        } else {
            log.warn("Provider '{}' failed its initial connection test and stays offline", provider.getId());
        }
        return true;
    }

    /**
     * Removes a provider together with its status, load counter and cost account.
     *
     * @return {@code false} if no such provider is registered.
     */
    public boolean unregister(final String providerId) {
        if (registrations.remove(providerId) == null) {
            log.warn("Provider '{}' not found for removal", providerId);
            return false;
        }
        healthTracker.untrack(providerId);
        costLedger.close(providerId);
        loadCounter.remove(providerId);
        transport.evict(providerId);
        log.info("Provider '{}' removed", providerId);
        return true;
    }

    /**
     * Replaces a provider's configuration in place and re-probes it. A failed probe marks the provider OFFLINE;
     * the new configuration is kept either way.
     *
     * @return {@code true} only if the provider exists and the probe with the new configuration succeeded.
     */
    public boolean reconfigure(final String providerId, final ProviderConfig config) {
        final Registration updated = registrations.computeIfPresent(providerId,
                (id, current) -> new Registration(current.provider().withConfig(config), current.sequence()));
        if (updated == null) {
            log.error("Provider '{}' not found for reconfiguration", providerId);
            return false;
        }
        transport.evict(providerId);
        costLedger.open(providerId, config.getCostPerMegabyte());

        if (probe(updated.provider())) {
            log.info("Provider '{}' reconfigured successfully", providerId);
            return true;
        }
        log.warn("Provider '{}' reconfigured but its connection test failed; marking it offline", providerId);
        healthTracker.markOffline(providerId);
        return false;
    }

    public Optional<Provider> find(final String providerId) {
        return Optional.ofNullable(registrations.get(providerId)).map(Registration::provider);
    }

    public boolean contains(final String providerId) {
        return registrations.containsKey(providerId);
    }

    /**
     * @return all providers ordered by ascending priority rank, then by registration order.
     */
    public List<Provider> listProviders() {
        return registrations.values().stream().sorted(FAILOVER_ORDER).map(Registration::provider).toList();
    }

    /**
     * @return the currently healthy providers, in failover order.
     */
    public List<Provider> healthyProviders() {
        return listProviders().stream().filter(p -> healthTracker.isHealthy(p.getId())).toList();
    }

    public List<ProviderStatus> listStatuses() {
        return healthTracker.getStatuses();
    }

    /**
     * Probes every registered provider.
     *
     * @return {@code true} if at least one provider is healthy afterwards.
     */
    public boolean performHealthCheck() {
        log.info("Performing health check on {} providers", registrations.size());
        boolean anyHealthy = false;
        for (final Provider provider : listProviders()) {
            probe(provider);
            anyHealthy |= healthTracker.isHealthy(provider.getId());
        }
        if (!anyHealthy) {
            log.error("No healthy upload providers available!");
        }
        return anyHealthy;
    }

    /**
     * Probes a single provider.
     *
     * @return {@code true} if the provider exists and is healthy afterwards.
     */
    public boolean performHealthCheck(final String providerId) {
        final Optional<Provider> provider = find(providerId);
        if (provider.isEmpty()) {
            return false;
        }
        probe(provider.get());
        log.debug("Health check completed for provider '{}'", providerId);
        return healthTracker.isHealthy(providerId);
    }

    /**
     * Brings a provider back after an outage: if a probe succeeds, its statistics are cleared and the probe
     * recorded, leaving it OPTIMAL.
     *
     * @return {@code true} if the provider exists and answered the probe.
     */
    public boolean recoverProvider(final String providerId) {
        final Optional<Provider> provider = find(providerId);
        if (provider.isEmpty()) {
            log.error("Provider '{}' not found for recovery", providerId);
            return false;
        }
        log.info("Attempting to recover provider '{}'", providerId);
        final long start = clock.millis();
        if (!testConnection(provider.get())) {
            log.error("Provider '{}' recovery failed", providerId);
            return false;
        }
        healthTracker.resetStatistics(providerId);
        healthTracker.recordAttempt(providerId, true, clock.millis() - start);
        log.info("Provider '{}' recovered", providerId);
        return true;
    }

    private boolean probe(final Provider provider) {
        final long start = clock.millis();
        final boolean connected = testConnection(provider);
        healthTracker.recordAttempt(provider.getId(), connected, clock.millis() - start);
        return connected;
    }

    private boolean testConnection(final Provider provider) {
        try {
            return transport.testConnection(provider);
        } catch (RuntimeException e) {
            log.warn("Connection test for provider '{}' threw an exception", provider.getId(), e);
            return false;
        }
    }

    private record Registration(Provider provider, long sequence) {
    }
}
