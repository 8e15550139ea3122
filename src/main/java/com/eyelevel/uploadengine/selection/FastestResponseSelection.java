package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the healthy provider with the lowest rolling response time; ties go to the better priority.
 */
@Component
@RequiredArgsConstructor
public class FastestResponseSelection implements SelectionStrategy {

    private final HealthTracker healthTracker;

    @Override
    public LoadBalanceStrategy getStrategyName() {
        return LoadBalanceStrategy.FASTEST_RESPONSE;
    }

    @Override
    public Optional<Provider> select(final List<Provider> healthyProviders, final long estimatedSizeBytes) {
        return healthyProviders.stream().min(Comparator.comparingLong(this::responseTime));
    }

    private long responseTime(final Provider provider) {
        return healthTracker.getStatus(provider.getId())
                            .map(ProviderStatus::getAverageResponseTimeMs)
                            .orElse(Long.MAX_VALUE);
    }
}
