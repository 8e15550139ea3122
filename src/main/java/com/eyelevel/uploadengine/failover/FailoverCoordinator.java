package com.eyelevel.uploadengine.failover;

import com.eyelevel.uploadengine.event.ProviderFailoverEvent;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.BatchUploadResult;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.RetryOutcome;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.model.UploadResult;
import com.eyelevel.uploadengine.model.UploadStatus;
import com.eyelevel.uploadengine.registry.ProviderRegistry;
import com.eyelevel.uploadengine.retry.RetryEngine;
import com.eyelevel.uploadengine.selection.ProviderSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for uploads. Picks a primary provider, retries against it, and on exhaustion walks the
 * remaining healthy providers in priority order until one accepts the upload.
 * <p>
 * Within one call a provider is never tried twice. A total failure is returned to the caller and never
 * retried beyond what the {@link RetryEngine} already did per provider. Calls for different requests may
 * run concurrently; each blocks its own thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailoverCoordinator {

    private final ProviderSelector providerSelector;
    private final RetryEngine retryEngine;
    private final ProviderRegistry providerRegistry;
    private final HealthTracker healthTracker;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Uploads with the optimal primary provider, failing over to the other healthy providers.
     *
     * @param request the upload.
     * @return the result; {@link UploadStatus#NO_PROVIDER_AVAILABLE} without any transport call when
     * nothing is healthy.
     */
    public UploadResult uploadWithFailover(final UploadRequest request) {
        final Optional<Provider> primary = providerSelector.selectOptimalProvider(request.getEstimatedSizeBytes());
        if (primary.isEmpty()) {
            log.error("[{}] No healthy provider available ({} priority)", request.getRequestId(),
                    request.getPriority());
            return UploadResult.noProviderAvailable(request.getRequestId());
        }
        return uploadStartingWith(primary.get(), request);
    }

    /**
     * Uploads with a provider chosen by the active load-balancing strategy alone, failing over on exhaustion.
     */
    public UploadResult uploadWithLoadBalancing(final UploadRequest request) {
        final Optional<Provider> selected = providerSelector.selectByStrategy(request.getEstimatedSizeBytes());
        if (selected.isEmpty()) {
            log.error("[{}] No available provider for load-balanced upload", request.getRequestId());
            return UploadResult.noProviderAvailable(request.getRequestId());
        }
        return uploadStartingWith(selected.get(), request);
    }

    /**
     * Groups the requests by the provider the selector picks for each and uploads group by group. An item whose
     * group provider fails over to the other healthy providers on its own; an item whose group provider has gone
     * unhealthy in the meantime, or that no provider could be selected for, goes through
     * {@link #uploadWithFailover}. A failed item never stops the rest of the batch.
     *
     * @param requests the batch.
     * @return one result per request.
     */
    public BatchUploadResult batchUploadOptimized(final List<UploadRequest> requests) {
        if (requests.isEmpty()) {
            log.warn("Empty batch upload request");
            return new BatchUploadResult(List.of());
        }
        log.info("Starting optimized batch upload of {} items", requests.size());

        final Map<String, List<UploadRequest>> groups = new LinkedHashMap<>();
        final Map<String, Provider> groupProviders = new LinkedHashMap<>();
        final List<UploadRequest> unassigned = new ArrayList<>();
        for (final UploadRequest request : requests) {
            final Optional<Provider> provider = providerSelector.selectOptimalProvider(request.getEstimatedSizeBytes());
            if (provider.isPresent()) {
                groupProviders.putIfAbsent(provider.get().getId(), provider.get());
                groups.computeIfAbsent(provider.get().getId(), id -> new ArrayList<>()).add(request);
            } else {
                unassigned.add(request);
            }
        }

        final List<UploadResult> results = new ArrayList<>();
        groups.forEach((providerId, groupRequests) -> {
            final Provider provider = groupProviders.get(providerId);
            log.info("Uploading {} items to provider '{}'", groupRequests.size(), providerId);
            for (final UploadRequest request : groupRequests) {
                results.add(uploadBatchItem(provider, request));
            }
        });
        for (final UploadRequest request : unassigned) {
            results.add(uploadWithFailover(request));
        }

        final BatchUploadResult batchResult = new BatchUploadResult(results);
        log.info("Batch upload completed: {}/{} succeeded, {} via failover", batchResult.successCount(),
                requests.size(), batchResult.failedOverCount());
        return batchResult;
    }

    /**
     * Manually moves traffic away from a provider by marking it OFFLINE.
     *
     * @param fromProviderId the provider to take out of rotation.
     * @param toProviderId   the provider expected to take over; must be healthy.
     * @return {@code false} if either provider is unknown or the target is not healthy.
     */
    public boolean triggerFailover(final String fromProviderId, final String toProviderId) {
        if (!providerRegistry.contains(fromProviderId) || !providerRegistry.contains(toProviderId)) {
            log.error("Invalid providers for failover: '{}' -> '{}'", fromProviderId, toProviderId);
            return false;
        }
        if (fromProviderId.equals(toProviderId)) {
            log.error("Cannot fail over provider '{}' to itself", fromProviderId);
            return false;
        }
        if (!healthTracker.isHealthy(toProviderId)) {
            log.error("Target provider '{}' not healthy for failover", toProviderId);
            return false;
        }
        log.info("Triggering failover from '{}' to '{}'", fromProviderId, toProviderId);
        healthTracker.markOffline(fromProviderId);
        eventPublisher.publishEvent(new ProviderFailoverEvent(null, fromProviderId, toProviderId));
        return true;
    }

    private UploadResult uploadBatchItem(final Provider provider, final UploadRequest request) {
        if (!healthTracker.isHealthy(provider.getId())) {
            log.warn("[{}] Provider '{}' became unhealthy during the batch; using failover", request.getRequestId(),
                    provider.getId());
            return uploadWithFailover(request);
        }
        final UploadResult result = uploadStartingWith(provider, request);
        if (!result.isSuccessful()) {
            log.error("[{}] Batch item failed on every provider tried", request.getRequestId());
        }
        return result;
    }

    private UploadResult uploadStartingWith(final Provider primary, final UploadRequest request) {
        if (retryEngine.execute(primary, request) == RetryOutcome.SUCCESS) {
            log.info("[{}] Upload successful with primary provider '{}'", request.getRequestId(), primary.getId());
            return new UploadResult(request.getRequestId(), UploadStatus.UPLOADED, primary.getId(),
                    List.of(primary.getId()));
        }
        return failOver(primary, request);
    }

    private UploadResult failOver(final Provider primary, final UploadRequest request) {
        final List<String> attempted = new ArrayList<>();
        attempted.add(primary.getId());

        final List<Provider> candidates = providerRegistry.healthyProviders().stream()
                                                          .filter(p -> !p.getId().equals(primary.getId()))
                                                          .toList();
        for (final Provider candidate : candidates) {
            log.info("[{}] Attempting failover upload to provider '{}'", request.getRequestId(), candidate.getId());
            attempted.add(candidate.getId());
            if (retryEngine.execute(candidate, request) == RetryOutcome.SUCCESS) {
                log.info("[{}] Failover upload successful with provider '{}'", request.getRequestId(),
                        candidate.getId());
                eventPublisher.publishEvent(
                        new ProviderFailoverEvent(request.getRequestId(), primary.getId(), candidate.getId()));
                return new UploadResult(request.getRequestId(), UploadStatus.FAILED_OVER, candidate.getId(),
                        attempted);
            }
        }

        log.error("[{}] Upload failed with all available providers: {} ({} priority)", request.getRequestId(),
                attempted, request.getPriority());
        return new UploadResult(request.getRequestId(), UploadStatus.EXHAUSTED, null, attempted);
    }
}
