package com.eyelevel.uploadengine.dto.report;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;

import java.util.List;

/**
 * @param strategy  the active load-balancing strategy.
 * @param providers per-provider counters, ordered by id.
 */
public record PerformanceReport(LoadBalanceStrategy strategy, List<ProviderPerformance> providers) {
}
