package com.eyelevel.uploadengine.cost;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.event.CostThresholdExceededEvent;
import com.eyelevel.uploadengine.model.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks the estimated spend of each provider in the current billing period against a shared monthly budget.
 * <p>
 * Rates are data: every provider carries its own price per megabyte. Periods roll over lazily on the next
 * recorded spend, so totals read between rollovers may be stale. The budget is a soft control; nothing here
 * blocks an upload. Spend is recorded under one ledger-wide lock, so a budget crossing is detected exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostLedger {

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private final ConcurrentMap<String, Account> accounts = new ConcurrentHashMap<>();
    private final Object spendLock = new Object();
    private final UploadEngineConfig config;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Opens a spend account for a provider.
     *
     * @param providerId      the provider.
     * @param costPerMegabyte its rate, or {@code null} to use the configured default rate.
     */
    public void open(final String providerId, final Double costPerMegabyte) {
        final double rate = costPerMegabyte != null ? costPerMegabyte : config.getBudget().getDefaultCostPerMegabyte();
        accounts.compute(providerId, (id, existing) -> {
            if (existing == null) {
                return new Account(rate, clock.instant());
            }
            existing.setRate(rate);
            return existing;
        });
        log.debug("Cost account for provider '{}' uses a rate of {} per MB", providerId, rate);
    }

    public void close(final String providerId) {
        accounts.remove(providerId);
    }

    /**
     * Estimates what uploading {@code bytes} to a provider costs. Unknown providers are priced at the default rate.
     */
    public double estimateCost(final String providerId, final long bytes) {
        final Account account = accounts.get(providerId);
        final double rate = account != null ? account.getRate() : config.getBudget().getDefaultCostPerMegabyte();
        return bytes / BYTES_PER_MEGABYTE * rate;
    }

    /**
     * Adds the estimated cost of a confirmed upload to the provider's current period, starting a new period
     * first if the old one has elapsed.
     *
     * @return the provider's spend in the current period after this upload.
     */
    public double recordSpend(final String providerId, final long bytes) {
        final Account account = accounts.get(providerId);
        if (account == null) {
            log.warn("No cost account for provider '{}'; spend of {} bytes not recorded", providerId, bytes);
            return 0.0;
        }
        final double budget = getBudget();
        final double periodSpend;
        final double totalAfter;
        final boolean crossed;
        synchronized (spendLock) {
            final double totalBefore = totalMonthlySpend();
            periodSpend = account.add(estimateCost(providerId, bytes), clock.instant(), periodLength(), providerId);
            totalAfter = totalMonthlySpend();
            crossed = totalBefore <= budget && totalAfter > budget;
        }
        if (crossed) {
            log.warn("Monthly cost crossed the budget: {} > {}", totalAfter, budget);
            eventPublisher.publishEvent(new CostThresholdExceededEvent(totalAfter, budget));
        }
        return periodSpend;
    }

    public double totalMonthlySpend() {
        return accounts.values().stream().mapToDouble(Account::getSpend).sum();
    }

    public Map<String, Double> spendByProvider() {
        final Map<String, Double> spend = new LinkedHashMap<>();
        accounts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> spend.put(entry.getKey(), entry.getValue().getSpend()));
        return spend;
    }

    public double getBudget() {
        return config.getBudget().getMaxMonthlyCost();
    }

    public boolean withinBudget() {
        return totalMonthlySpend() <= getBudget();
    }

    /**
     * Compares the current spend with the budget, publishing a threshold event when it is over.
     * Polled by collaborators that decide whether to throttle.
     *
     * @return whether spend is within budget.
     */
    public boolean evaluateBudget() {
        final double total = totalMonthlySpend();
        final double budget = getBudget();
        if (total > budget) {
            log.warn("Monthly cost exceeds budget: {} > {}", total, budget);
            eventPublisher.publishEvent(new CostThresholdExceededEvent(total, budget));
            return false;
        }
        log.info("Monthly cost {} is within budget {}", total, budget);
        return true;
    }

    /**
     * Finds the candidate with the lowest estimated cost for a payload. Candidates are expected in failover order;
     * on equal cost the earlier one wins.
     *
     * @param candidates    the providers to choose from, usually the healthy ones.
     * @param bytes         size of the payload.
     * @return the cheapest candidate, or empty if there are none.
     */
    public Optional<Provider> cheapestProvider(final List<Provider> candidates, final long bytes) {
        Provider cheapest = null;
        double lowestCost = Double.MAX_VALUE;
        for (final Provider candidate : candidates) {
            final double cost = estimateCost(candidate.getId(), bytes);
            if (cheapest == null || cost < lowestCost) {
                cheapest = candidate;
                lowestCost = cost;
            }
        }
        return Optional.ofNullable(cheapest);
    }

    private Duration periodLength() {
        return Duration.ofDays(config.getBudget().getPeriodDays());
    }

    private static final class Account {

        private double rate;
        private double spend;
        private Instant periodStart;

        private Account(final double rate, final Instant periodStart) {
            this.rate = rate;
            this.periodStart = periodStart;
        }

        synchronized double add(final double cost, final Instant now, final Duration period, final String providerId) {
            if (Duration.between(periodStart, now).compareTo(period) > 0) {
                log.info("Cost period for provider '{}' elapsed; resetting spend of {}", providerId, spend);
                spend = 0.0;
                periodStart = now;
            }
            spend += cost;
            return spend;
        }

        synchronized double getRate() {
            return rate;
        }

        synchronized void setRate(final double rate) {
            this.rate = rate;
        }

        synchronized double getSpend() {
            return spend;
        }
    }
}
