package com.eyelevel.uploadengine.support;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.failover.FailoverCoordinator;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderConfig;
import com.eyelevel.uploadengine.model.ProviderPlatform;
import com.eyelevel.uploadengine.model.UploadRequest;
import com.eyelevel.uploadengine.registry.ProviderRegistry;
import com.eyelevel.uploadengine.report.ReportService;
import com.eyelevel.uploadengine.retry.JitteredExponentialBackOffPolicy;
import com.eyelevel.uploadengine.retry.RetryEngine;
import com.eyelevel.uploadengine.retry.UploadRetryListener;
import com.eyelevel.uploadengine.selection.CostOptimizedSelection;
import com.eyelevel.uploadengine.selection.FastestResponseSelection;
import com.eyelevel.uploadengine.selection.LeastLoadedSelection;
import com.eyelevel.uploadengine.selection.LoadCounter;
import com.eyelevel.uploadengine.selection.ProviderSelector;
import com.eyelevel.uploadengine.selection.RoundRobinSelection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires a complete engine from real components around a fake transport, a mutable clock and a backoff that
 * records its delays instead of sleeping.
 */
public class EngineFixture {

    public final UploadEngineConfig config = new UploadEngineConfig();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final FakeUploadTransport transport = new FakeUploadTransport();
    public final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

    public final HealthTracker healthTracker;
    public final CostLedger costLedger;
    public final LoadCounter loadCounter;
    public final ProviderRegistry registry;
    public final ProviderSelector selector;
    public final RetryEngine retryEngine;
    public final FailoverCoordinator coordinator;
    public final ReportService reports;

    public EngineFixture() {
        this(config -> {
        });
    }

    public EngineFixture(final Consumer<UploadEngineConfig> customizer) {
        customizer.accept(config);
        healthTracker = new HealthTracker(events, clock);
        costLedger = new CostLedger(config, events, clock);
        loadCounter = new LoadCounter();
        registry = new ProviderRegistry(transport, healthTracker, costLedger, loadCounter, clock);
        selector = new ProviderSelector(registry, costLedger, loadCounter, config, List.of(
                new RoundRobinSelection(),
                new LeastLoadedSelection(loadCounter),
                new FastestResponseSelection(healthTracker),
                new CostOptimizedSelection(costLedger)));
        final JitteredExponentialBackOffPolicy backOff = new JitteredExponentialBackOffPolicy(
                config.getRetry().getBaseDelayMs(), config.getRetry().getMaxDelayMs(),
                config.getRetry().getJitterRatio()).withSleeper(sleeps::add);
        retryEngine = new RetryEngine(transport, healthTracker, costLedger, backOff, new UploadRetryListener(), clock);
        coordinator = new FailoverCoordinator(selector, retryEngine, registry, healthTracker, events);
        reports = new ReportService(healthTracker, costLedger, selector, loadCounter, clock);
    }

    public static Provider provider(final String id, final int priority) {
        return provider(id, priority, null);
    }

    public static Provider provider(final String id, final int priority, final Double costPerMegabyte) {
        return Provider.builder()
                       .id(id)
                       .platform(ProviderPlatform.CUSTOM)
                       .priority(priority)
                       .config(ProviderConfig.builder()
                                             .bucketName(id + "-bucket")
                                             .costPerMegabyte(costPerMegabyte)
                                             .build())
                       .build();
    }

    public static UploadRequest request(final String id, final long bytes, final int maxRetries) {
        return UploadRequest.builder()
                            .requestId(id)
                            .estimatedSizeBytes(bytes)
                            .targetPath("uploads/" + id)
                            .maxRetries(maxRetries)
                            .build();
    }

    /**
     * Registers healthy providers with the given ids, priorities 1..n in order.
     */
    public void registerHealthy(final String... ids) {
        for (int i = 0; i < ids.length; i++) {
            registry.register(provider(ids[i], i + 1));
        }
        transport.clearCalls();
        events.clear();
    }
}
