package com.eyelevel.uploadengine.selection;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;

import java.util.List;
import java.util.Optional;

/**
 * Defines the contract for a load-balancing policy. Implementations are Spring beans looked up by
 * {@link #getStrategyName()}.
 */
public interface SelectionStrategy {

    LoadBalanceStrategy getStrategyName();

    /**
     * Picks one provider.
     *
     * @param healthyProviders   the currently healthy providers in failover order; never empty.
     * @param estimatedSizeBytes size of the payload to place.
     * @return the chosen provider, which must be an element of {@code healthyProviders}.
     */
    Optional<Provider> select(List<Provider> healthyProviders, long estimatedSizeBytes);

    /**
     * Forgets any state kept between selections.
     */
    default void reset() {
    }
}
