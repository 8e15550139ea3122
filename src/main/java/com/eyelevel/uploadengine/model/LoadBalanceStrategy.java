package com.eyelevel.uploadengine.model;

/**
 * Policies for picking one provider among several healthy ones.
 */
public enum LoadBalanceStrategy {
    /**
     * Cycles over the currently healthy providers with an index that persists across calls.
     */
    ROUND_ROBIN,
    /**
     * Picks the healthy provider that has been selected the fewest times.
     */
    LEAST_LOADED,
    /**
     * Picks the healthy provider with the lowest rolling response time.
     */
    FASTEST_RESPONSE,
    /**
     * Picks the healthy provider with the lowest estimated cost for the payload.
     */
    COST_OPTIMIZED
}
