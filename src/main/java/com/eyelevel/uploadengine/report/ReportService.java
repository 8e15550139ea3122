package com.eyelevel.uploadengine.report;

import com.eyelevel.uploadengine.cost.CostLedger;
import com.eyelevel.uploadengine.dto.report.CostReport;
import com.eyelevel.uploadengine.dto.report.HealthReport;
import com.eyelevel.uploadengine.dto.report.PerformanceReport;
import com.eyelevel.uploadengine.dto.report.ProviderPerformance;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.ProviderStatus;
import com.eyelevel.uploadengine.selection.LoadCounter;
import com.eyelevel.uploadengine.selection.ProviderSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Builds read-only reports over the engine's health, cost and load state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final HealthTracker healthTracker;
    private final CostLedger costLedger;
    private final ProviderSelector providerSelector;
    private final LoadCounter loadCounter;
    private final Clock clock;

    public HealthReport healthReport() {
        final List<ProviderStatus> statuses = healthTracker.getStatuses();
        final int healthy = (int) statuses.stream().filter(ProviderStatus::isAvailable).count();
        log.debug("Building health report for {} providers ({} healthy)", statuses.size(), healthy);
        return new HealthReport(healthTracker.overallHealth(), statuses.size(), healthy, statuses, clock.instant());
    }

    public CostReport costReport() {
        return new CostReport(costLedger.totalMonthlySpend(), costLedger.getBudget(), costLedger.withinBudget(),
                costLedger.spendByProvider());
    }

    public PerformanceReport performanceReport() {
        final List<ProviderPerformance> providers = healthTracker.getStatuses().stream()
                                                                 .map(this::toPerformance)
                                                                 .toList();
        return new PerformanceReport(providerSelector.getStrategy(), providers);
    }

    private ProviderPerformance toPerformance(final ProviderStatus status) {
        return new ProviderPerformance(status.getProviderId(), status.getHealth(), status.getQuality(),
                status.getAverageResponseTimeMs(), status.getSuccessRate(), status.getTotalAttempts(),
                status.getFailedAttempts(), status.getBytesTransferred(), loadCounter.get(status.getProviderId()),
                status.getQuality().getOptimalChunkSizeBytes());
    }
}
