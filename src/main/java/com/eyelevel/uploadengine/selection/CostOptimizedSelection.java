package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the healthy provider with the lowest estimated cost for the payload; ties go to the better priority.
 */
@Component
@RequiredArgsConstructor
public class CostOptimizedSelection implements SelectionStrategy {

    private final CostLedger costLedger;

    @Override
    public LoadBalanceStrategy getStrategyName() {
        return LoadBalanceStrategy.COST_OPTIMIZED;
    }

    @Override
    public Optional<Provider> select(final List<Provider> healthyProviders, final long estimatedSizeBytes) {
        return costLedger.cheapestProvider(healthyProviders, estimatedSizeBytes);
    }
}
