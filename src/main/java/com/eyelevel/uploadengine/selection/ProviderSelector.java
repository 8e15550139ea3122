package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the provider for a new upload. Only healthy providers are ever returned; an empty result means
 * no provider is available.
 * <p>
 * The active {@link LoadBalanceStrategy} starts from {@code app.upload.load-balance-strategy} and can be
 * switched at runtime. Every selection increments the chosen provider's load counter.
 */
@Slf4j
@Service
public class ProviderSelector {

    private final ProviderRegistry providerRegistry;
    private final CostLedger costLedger;
    private final LoadCounter loadCounter;
    private final UploadEngineConfig config;
    private final Map<LoadBalanceStrategy, SelectionStrategy> strategies = new EnumMap<>(LoadBalanceStrategy.class);
    private volatile LoadBalanceStrategy activeStrategy;

    public ProviderSelector(final ProviderRegistry providerRegistry, final CostLedger costLedger,
                            final LoadCounter loadCounter, final UploadEngineConfig config,
                            final Collection<SelectionStrategy> selectionStrategies) {
        this.providerRegistry = providerRegistry;
        this.costLedger = costLedger;
        this.loadCounter = loadCounter;
        this.config = config;
        selectionStrategies.forEach(strategy -> strategies.put(strategy.getStrategyName(), strategy));
        this.activeStrategy = config.getLoadBalanceStrategy() != null
                ? config.getLoadBalanceStrategy()
                : LoadBalanceStrategy.ROUND_ROBIN;
        log.info("ProviderSelector initialized with {} strategies. Active strategy: {}, cost optimization: {}",
                strategies.size(), activeStrategy, config.isEnableCostOptimization());
    }

    /**
     * Picks the primary provider for a payload. With cost optimization enabled the cheapest healthy provider
     * wins; otherwise, or if there is none, the active strategy decides.
     *
     * @param estimatedSizeBytes size of the payload.
     * @return the chosen provider, or empty if no provider is healthy.
     */
    public Optional<Provider> selectOptimalProvider(final long estimatedSizeBytes) {
        if (config.isEnableCostOptimization()) {
            final Optional<Provider> cheapest = costLedger.cheapestProvider(providerRegistry.healthyProviders(),
                    estimatedSizeBytes);
            if (cheapest.isPresent()) {
                loadCounter.increment(cheapest.get().getId());
                return cheapest;
            }
        }
        return selectByStrategy(estimatedSizeBytes);
    }

    /**
     * Picks a provider with the active strategy only, skipping the cost-first shortcut.
     */
    public Optional<Provider> selectByStrategy(final long estimatedSizeBytes) {
        final List<Provider> healthy = providerRegistry.healthyProviders();
        if (healthy.isEmpty()) {
            log.warn("No healthy provider available for a payload of {} bytes", estimatedSizeBytes);
            return Optional.empty();
        }
        final SelectionStrategy strategy = strategies.get(activeStrategy);
        if (strategy == null) {
            throw new IllegalStateException("No selection strategy registered for " + activeStrategy);
        }
        final Optional<Provider> selected = strategy.select(healthy, estimatedSizeBytes);
        selected.ifPresent(provider -> {
            loadCounter.increment(provider.getId());
            log.debug("{} selected provider '{}' for {} bytes", activeStrategy, provider.getId(), estimatedSizeBytes);
        });
        return selected;
    }

    public LoadBalanceStrategy getStrategy() {
        return activeStrategy;
    }

    public void setStrategy(final LoadBalanceStrategy strategy) {
        if (!strategies.containsKey(strategy)) {
            throw new IllegalArgumentException("Unsupported load balance strategy: " + strategy);
        }
        log.info("Load balance strategy changed from {} to {}", activeStrategy, strategy);
        activeStrategy = strategy;
    }

    /**
     * Clears load counters and the round-robin position.
     */
    public void redistributeLoad() {
        loadCounter.reset();
        strategies.values().forEach(SelectionStrategy::reset);
        log.info("Load redistribution completed");
    }
}
