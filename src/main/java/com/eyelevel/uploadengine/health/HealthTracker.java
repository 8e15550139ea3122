package com.eyelevel.uploadengine.health;

import com.eyelevel.uploadengine.event.ProviderHealthChangedEvent;
import com.eyelevel.uploadengine.model.ConnectionQuality;
import com.eyelevel.uploadengine.model.HealthStatus;
import com.eyelevel.uploadengine.model.ProviderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the runtime status of every registered provider and is the only component that writes it.
 * <p>
 * Each provider's statistics are guarded by their own lock, so attempts against different providers
 * never contend. Health-change events are published after the lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthTracker {

    private final ConcurrentMap<String, TrackedProvider> tracked = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Starts tracking a provider. Its status begins as OFFLINE and unavailable.
     *
     * @param providerId the provider to track.
     * @return {@code false} if the provider was already tracked.
     */
    public boolean track(final String providerId) {
        final TrackedProvider previous = tracked.putIfAbsent(providerId, new TrackedProvider(providerId));
        return previous == null;
    }

    /**
     * Drops a provider's status and counters.
     */
    public void untrack(final String providerId) {
        tracked.remove(providerId);
    }

    public void recordAttempt(final String providerId, final boolean success, final long responseTimeMs) {
        recordAttempt(providerId, success, responseTimeMs, 0L);
    }

    /**
     * Folds the outcome of one attempt (upload or probe) into the provider's statistics and
     * re-derives its quality tier and health classification.
     *
     * @param providerId       the provider the attempt ran against.
     * @param success          whether the attempt succeeded.
     * @param responseTimeMs   measured duration of the attempt.
     * @param bytesTransferred bytes sent by a successful upload.
     */
    public void recordAttempt(final String providerId, final boolean success, final long responseTimeMs,
                              final long bytesTransferred) {
        final TrackedProvider provider = tracked.get(providerId);
        if (provider == null) {
            log.debug("Ignoring attempt outcome for untracked provider '{}'", providerId);
            return;
        }
        provider.record(success, responseTimeMs, bytesTransferred, clock.instant()).ifPresent(this::publish);
    }

    /**
     * Forces a provider to OFFLINE, e.g. after a failed probe or a manual failover.
     */
    public void markOffline(final String providerId) {
        final TrackedProvider provider = tracked.get(providerId);
        if (provider != null) {
            provider.forceOffline(clock.instant()).ifPresent(this::publish);
        }
    }

    /**
     * Clears the attempt statistics of a provider, keeping its current classification until the
     * next recorded attempt.
     */
    public void resetStatistics(final String providerId) {
        final TrackedProvider provider = tracked.get(providerId);
        if (provider != null) {
            provider.resetStatistics();
        }
    }

    public boolean isHealthy(final String providerId) {
        final TrackedProvider provider = tracked.get(providerId);
        return provider != null && provider.isHealthy();
    }

    public Optional<ProviderStatus> getStatus(final String providerId) {
        return Optional.ofNullable(tracked.get(providerId)).map(TrackedProvider::snapshot);
    }

    public List<ProviderStatus> getStatuses() {
        return tracked.values().stream()
                      .map(TrackedProvider::snapshot)
                      .sorted(Comparator.comparing(ProviderStatus::getProviderId))
                      .toList();
    }

    /**
     * Classifies the fleet by the share of providers that are currently OPTIMAL or DEGRADED.
     */
    public HealthStatus overallHealth() {
        final List<ProviderStatus> statuses = getStatuses();
        final int healthy = (int) statuses.stream().filter(s -> s.getHealth().isAvailable()).count();
        return HealthStatus.fromHealthyRatio(healthy, statuses.size());
    }

    private void publish(final ProviderHealthChangedEvent event) {
        eventPublisher.publishEvent(event);
    }

    private static final class TrackedProvider {

        private final String providerId;
        private HealthStatus health = HealthStatus.OFFLINE;
        private ConnectionQuality quality = ConnectionQuality.POOR;
        private long averageResponseTimeMs;
        private double successRate;
        private long totalAttempts;
        private long failedAttempts;
        private long bytesTransferred;
        private Instant lastHealthCheck;

        private TrackedProvider(final String providerId) {
            this.providerId = providerId;
        }

        synchronized Optional<ProviderHealthChangedEvent> record(final boolean success, final long responseTimeMs,
                                                                 final long bytes, final Instant now) {
            totalAttempts++;
            if (success) {
                // Exponential smoothing with factor 0.5, not a windowed average.
                averageResponseTimeMs = (averageResponseTimeMs + responseTimeMs) / 2;
                bytesTransferred += bytes;
            } else {
                failedAttempts++;
            }
            successRate = (double) (totalAttempts - failedAttempts) / totalAttempts * 100.0;
            quality = ConnectionQuality.assess(averageResponseTimeMs, successRate);
            lastHealthCheck = now;
            return transitionTo(HealthStatus.fromSuccessRate(successRate));
        }

        synchronized Optional<ProviderHealthChangedEvent> forceOffline(final Instant now) {
            lastHealthCheck = now;
            return transitionTo(HealthStatus.OFFLINE);
        }

        synchronized void resetStatistics() {
            averageResponseTimeMs = 0;
            successRate = 0;
            totalAttempts = 0;
            failedAttempts = 0;
            bytesTransferred = 0;
            quality = ConnectionQuality.POOR;
        }

        synchronized boolean isHealthy() {
            return health.isAvailable();
        }

        synchronized ProviderStatus snapshot() {
            return ProviderStatus.builder()
                                 .providerId(providerId)
                                 .health(health)
                                 .quality(quality)
                                 .averageResponseTimeMs(averageResponseTimeMs)
                                 .successRate(successRate)
                                 .totalAttempts(totalAttempts)
                                 .failedAttempts(failedAttempts)
                                 .bytesTransferred(bytesTransferred)
                                 .available(health.isAvailable())
                                 .lastHealthCheck(lastHealthCheck)
                                 .build();
        }

        private Optional<ProviderHealthChangedEvent> transitionTo(final HealthStatus next) {
            final HealthStatus previous = health;
            health = next;
            if (previous == next) {
                return Optional.empty();
            }
            return Optional.of(new ProviderHealthChangedEvent(providerId, previous, next));
        }
    }
}
