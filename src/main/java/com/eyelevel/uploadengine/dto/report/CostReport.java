package com.eyelevel.uploadengine.dto.report;

import java.util.Map;

/**
 * Spend of the current billing period against the monthly budget.
 *
 * @param totalMonthlySpend sum over all providers.
 * @param budget            configured ceiling.
 * @param withinBudget      {@code totalMonthlySpend <= budget}.
 * @param spendByProvider   spend per provider id, ordered by id.
 */
public record CostReport(double totalMonthlySpend, double budget, boolean withinBudget,
                         Map<String, Double> spendByProvider) {
}
