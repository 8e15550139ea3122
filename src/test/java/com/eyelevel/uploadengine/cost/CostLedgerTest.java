package com.eyelevel.uploadengine.cost;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.event.CostThresholdExceededEvent;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.support.EngineFixture;
import com.eyelevel.uploadengine.support.MutableClock;
import com.eyelevel.uploadengine.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CostLedger")
class CostLedgerTest {

    private static final long MB = 1024L * 1024L;

    private UploadEngineConfig config;
    private MutableClock clock;
    private RecordingEventPublisher events;
    private CostLedger ledger;

    @BeforeEach
    void setUp() {
        config = new UploadEngineConfig();
        config.getBudget().setMaxMonthlyCost(1.0);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        events = new RecordingEventPublisher();
        ledger = new CostLedger(config, events, clock);
    }

    private Provider open(final String providerId, final int priority, final Double rate) {
        ledger.open(providerId, rate);
        return EngineFixture.provider(providerId, priority, rate);
    }

    @Nested
    @DisplayName("Estimating")
    class Estimating {

        @Test
        @DisplayName("Should price megabytes of 1024*1024 bytes at the provider's rate")
        void shouldPriceAtProviderRate() {
            ledger.open("aws", 0.023);

            assertEquals(0.23, ledger.estimateCost("aws", 10 * MB), 1e-9);
        }

        @Test
        @DisplayName("Should fall back to the default rate")
        void shouldFallBackToDefaultRate() {
            ledger.open("custom", null);

            assertEquals(0.025, ledger.estimateCost("custom", MB), 1e-9);
            assertEquals(0.025, ledger.estimateCost("unknown", MB), 1e-9);
        }

        @Test
        @DisplayName("Should take the new rate when reopened")
        void shouldTakeNewRateWhenReopened() {
            ledger.open("aws", 0.023);
            ledger.recordSpend("aws", MB);

            ledger.open("aws", 0.05);

            assertEquals(0.05, ledger.estimateCost("aws", MB), 1e-9);
            assertEquals(0.023, ledger.totalMonthlySpend(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Recording spend")
    class RecordingSpend {

        @Test
        @DisplayName("Should accumulate within a period")
        void shouldAccumulate() {
            ledger.open("aws", 0.1);

            ledger.recordSpend("aws", MB);
            final double spend = ledger.recordSpend("aws", 2 * MB);

            assertEquals(0.3, spend, 1e-9);
            assertEquals(0.3, ledger.totalMonthlySpend(), 1e-9);
        }

        @Test
        @DisplayName("Should reset the period after more than 30 days")
        void shouldResetAfterPeriod() {
            ledger.open("aws", 0.1);
            ledger.recordSpend("aws", 5 * MB);

            clock.advance(Duration.ofDays(31));
            final double spend = ledger.recordSpend("aws", MB);

            assertEquals(0.1, spend, 1e-9);
            assertEquals(0.1, ledger.totalMonthlySpend(), 1e-9);
        }

        @Test
        @DisplayName("Should keep the period at exactly 30 days")
        void shouldKeepPeriodAtBoundary() {
            ledger.open("aws", 0.1);
            ledger.recordSpend("aws", 5 * MB);

            clock.advance(Duration.ofDays(30));
            ledger.recordSpend("aws", MB);

            assertEquals(0.6, ledger.totalMonthlySpend(), 1e-9);
        }

        @Test
        @DisplayName("Should ignore spend for unknown providers")
        void shouldIgnoreUnknownProvider() {
            assertEquals(0.0, ledger.recordSpend("ghost", MB), 1e-9);
            assertEquals(0.0, ledger.totalMonthlySpend(), 1e-9);
        }

        @Test
        @DisplayName("Should drop the account when closed")
        void shouldDropAccountWhenClosed() {
            ledger.open("aws", 0.1);
            ledger.recordSpend("aws", MB);

            ledger.close("aws");

            assertTrue(ledger.spendByProvider().isEmpty());
            assertEquals(0.0, ledger.totalMonthlySpend(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        @DisplayName("Should publish once when spend crosses the budget")
        void shouldPublishOnCrossing() {
            ledger.open("aws", 0.1);

            ledger.recordSpend("aws", 5 * MB);
            assertTrue(events.eventsOf(CostThresholdExceededEvent.class).isEmpty());

            ledger.recordSpend("aws", 6 * MB);
            ledger.recordSpend("aws", MB);

            final List<CostThresholdExceededEvent> published = events.eventsOf(CostThresholdExceededEvent.class);
            assertEquals(1, published.size());
            assertEquals(1.1, published.get(0).currentSpend(), 1e-9);
            assertEquals(1.0, published.get(0).budget(), 1e-9);
            assertFalse(ledger.withinBudget());
        }

        @Test
        @DisplayName("Should publish once when concurrent spend crosses the budget")
        void shouldPublishOnceUnderConcurrentCrossing() throws InterruptedException {
            ledger.open("aws", 0.1);
            ledger.open("gcp", 0.1);
            final int threadCount = 8;
            final var startLatch = new CountDownLatch(1);
            final var doneLatch = new CountDownLatch(threadCount);

            for (int i = 0; i < threadCount; i++) {
                final String providerId = i % 2 == 0 ? "aws" : "gcp";
                new Thread(() -> {
                    try {
                        startLatch.await();
                        for (int j = 0; j < 25; j++) {
                            ledger.recordSpend(providerId, MB);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                }).start();
            }
            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS));

            assertEquals(20.0, ledger.totalMonthlySpend(), 1e-6);
            assertEquals(1, events.eventsOf(CostThresholdExceededEvent.class).size());
        }

        @Test
        @DisplayName("Evaluation should alert whenever spend is over budget")
        void evaluationShouldAlertWhenOver() {
            ledger.open("aws", 0.1);
            ledger.recordSpend("aws", 11 * MB);
            events.clear();

            assertFalse(ledger.evaluateBudget());
            assertFalse(ledger.evaluateBudget());

            assertEquals(2, events.eventsOf(CostThresholdExceededEvent.class).size());
        }

        @Test
        @DisplayName("Evaluation should stay quiet within budget")
        void evaluationShouldStayQuietWithinBudget() {
            ledger.open("aws", 0.1);
            ledger.recordSpend("aws", MB);

            assertTrue(ledger.evaluateBudget());
            assertTrue(events.eventsOf(CostThresholdExceededEvent.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("Cheapest provider")
    class Cheapest {

        @Test
        @DisplayName("Should pick the lowest rate among the candidates")
        void shouldPickLowestRate() {
            final Provider aws = open("aws", 1, 0.023);
            final Provider gcp = open("gcp", 2, 0.020);
            open("offline", 3, 0.001);

            assertEquals(Optional.of(gcp), ledger.cheapestProvider(List.of(aws, gcp), 10 * MB));
        }

        @Test
        @DisplayName("Should break ties by failover order")
        void shouldBreakTiesByFailoverOrder() {
            final Provider zeta = open("zeta-primary", 1, 0.02);
            final Provider alpha = open("alpha-backup", 2, 0.02);

            assertEquals(Optional.of(zeta), ledger.cheapestProvider(List.of(zeta, alpha), MB));
        }

        @Test
        @DisplayName("Should be empty without candidates")
        void shouldBeEmptyWithoutCandidates() {
            ledger.open("aws", 0.02);

            assertTrue(ledger.cheapestProvider(List.of(), MB).isEmpty());
        }
    }

    @Test
    @DisplayName("Spend by provider should be ordered by id")
    void spendByProviderOrderedById() {
        ledger.open("gcp", 0.1);
        ledger.open("aws", 0.2);
        ledger.recordSpend("gcp", MB);

        final Map<String, Double> spend = ledger.spendByProvider();
        assertEquals(List.of("aws", "gcp"), List.copyOf(spend.keySet()));
        assertEquals(0.1, spend.get("gcp"), 1e-9);
    }
}
