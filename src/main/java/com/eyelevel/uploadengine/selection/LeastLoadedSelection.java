package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the healthy provider with the fewest selections so far; ties go to the better priority.
 */
@Component
@RequiredArgsConstructor
public class LeastLoadedSelection implements SelectionStrategy {

    private final LoadCounter loadCounter;

    @Override
    public LoadBalanceStrategy getStrategyName() {
        return LoadBalanceStrategy.LEAST_LOADED;
    }

    @Override
    public Optional<Provider> select(final List<Provider> healthyProviders, final long estimatedSizeBytes) {
        return healthyProviders.stream().min(Comparator.comparingLong(p -> loadCounter.get(p.getId())));
    }
}
