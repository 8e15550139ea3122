package com.eyelevel.uploadengine.event;

/**
 * Published when the estimated spend of the current period is above the monthly budget.
 */
public record CostThresholdExceededEvent(double currentSpend, double budget) {
}
