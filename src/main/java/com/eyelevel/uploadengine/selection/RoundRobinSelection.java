package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles over the healthy providers. The index persists across calls and is taken modulo the current number
 * of healthy providers, so the rotation adapts as providers come and go.
 */
@Component
public class RoundRobinSelection implements SelectionStrategy {

    private final AtomicLong index = new AtomicLong();

    @Override
    public LoadBalanceStrategy getStrategyName() {
        return LoadBalanceStrategy.ROUND_ROBIN;
    }

    @Override
    public Optional<Provider> select(final List<Provider> healthyProviders, final long estimatedSizeBytes) {
        final long next = index.getAndIncrement();
        return Optional.of(healthyProviders.get((int) Math.floorMod(next, (long) healthyProviders.size())));
    }

    @Override
    public void reset() {
        index.set(0L);
    }
}
