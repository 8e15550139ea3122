package com.eyelevel.uploadengine.health;

import com.eyelevel.uploadengine.event.ProviderHealthChangedEvent;
import com.eyelevel.uploadengine.model.ConnectionQuality;
import com.eyelevel.uploadengine.model.HealthStatus;
import com.eyelevel.uploadengine.model.ProviderStatus;
import com.eyelevel.uploadengine.support.MutableClock;
import com.eyelevel.uploadengine.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("HealthTracker")
class HealthTrackerTest {

    private MutableClock clock;
    private RecordingEventPublisher events;
    private HealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        events = new RecordingEventPublisher();
        tracker = new HealthTracker(events, clock);
        tracker.track("p1");
    }

    private ProviderStatus status() {
        return tracker.getStatus("p1").orElseThrow();
    }

    @Nested
    @DisplayName("Tracking")
    class Tracking {

        @Test
        @DisplayName("Should start a new provider OFFLINE and unavailable")
        void shouldStartOffline() {
            assertEquals(HealthStatus.OFFLINE, status().getHealth());
            assertFalse(status().isAvailable());
            assertFalse(tracker.isHealthy("p1"));
        }

        @Test
        @DisplayName("Should refuse to track the same provider twice")
        void shouldRefuseDuplicate() {
            assertFalse(tracker.track("p1"));
            assertTrue(tracker.track("p2"));
        }

        @Test
        @DisplayName("Should ignore attempts for untracked providers")
        void shouldIgnoreUntracked() {
            tracker.recordAttempt("ghost", true, 10);

            assertTrue(tracker.getStatus("ghost").isEmpty());
            assertTrue(events.eventsOf(ProviderHealthChangedEvent.class).isEmpty());
        }

        @Test
        @DisplayName("Should forget a provider once untracked")
        void shouldForgetUntracked() {
            tracker.untrack("p1");

            assertTrue(tracker.getStatus("p1").isEmpty());
            assertFalse(tracker.isHealthy("p1"));
        }
    }

    @Nested
    @DisplayName("Recording attempts")
    class RecordingAttempts {

        @Test
        @DisplayName("Should become OPTIMAL after a first success")
        void shouldBecomeOptimalAfterSuccess() {
            tracker.recordAttempt("p1", true, 80, 2048);

            final ProviderStatus status = status();
            assertEquals(HealthStatus.OPTIMAL, status.getHealth());
            assertTrue(status.isAvailable());
            assertEquals(100.0, status.getSuccessRate(), 1e-9);
            assertEquals(1, status.getTotalAttempts());
            assertEquals(2048, status.getBytesTransferred());
            assertEquals(clock.instant(), status.getLastHealthCheck());
        }

        @Test
        @DisplayName("Should blend response times of successful attempts only")
        void shouldBlendSuccessfulResponseTimes() {
            tracker.recordAttempt("p1", true, 100);
            assertEquals(50, status().getAverageResponseTimeMs());

            tracker.recordAttempt("p1", true, 100);
            assertEquals(75, status().getAverageResponseTimeMs());

            tracker.recordAttempt("p1", false, 5000);
            assertEquals(75, status().getAverageResponseTimeMs());
        }

        @Test
        @DisplayName("Should be DEGRADED at exactly 90% success")
        void shouldBeDegradedAtNinetyPercent() {
            for (int i = 0; i < 9; i++) {
                tracker.recordAttempt("p1", true, 10);
            }
            tracker.recordAttempt("p1", false, 10);

            assertEquals(90.0, status().getSuccessRate(), 1e-9);
            assertEquals(HealthStatus.DEGRADED, status().getHealth());
            assertTrue(tracker.isHealthy("p1"));
        }

        @Test
        @DisplayName("Should drop out of availability once failures dominate")
        void shouldDropOutOfAvailability() {
            tracker.recordAttempt("p1", true, 10);
            tracker.recordAttempt("p1", false, 10);
            tracker.recordAttempt("p1", false, 10);

            assertEquals(HealthStatus.OFFLINE, status().getHealth());
            assertEquals(2, status().getFailedAttempts());
            assertFalse(tracker.isHealthy("p1"));
        }

        @Test
        @DisplayName("Should rate a fast reliable link EXCELLENT")
        void shouldRateFastLinkExcellent() {
            tracker.recordAttempt("p1", true, 100);
            tracker.recordAttempt("p1", true, 100);

            assertEquals(ConnectionQuality.EXCELLENT, status().getQuality());
        }

        @Test
        @DisplayName("Should stamp each attempt with the clock")
        void shouldStampWithClock() {
            tracker.recordAttempt("p1", true, 10);
            clock.advance(Duration.ofMinutes(5));
            tracker.recordAttempt("p1", true, 10);

            assertEquals(Instant.parse("2024-03-01T12:05:00Z"), status().getLastHealthCheck());
        }
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("Should publish only on classification changes")
        void shouldPublishOnlyOnChange() {
            tracker.recordAttempt("p1", true, 10);
            tracker.recordAttempt("p1", true, 10);
            tracker.recordAttempt("p1", true, 10);

            final List<ProviderHealthChangedEvent> published = events.eventsOf(ProviderHealthChangedEvent.class);
            assertEquals(1, published.size());
            assertEquals(new ProviderHealthChangedEvent("p1", HealthStatus.OFFLINE, HealthStatus.OPTIMAL),
                    published.get(0));
        }

        @Test
        @DisplayName("Should publish when forced offline")
        void shouldPublishWhenForcedOffline() {
            tracker.recordAttempt("p1", true, 10);
            events.clear();

            tracker.markOffline("p1");

            assertEquals(HealthStatus.OFFLINE, status().getHealth());
            assertEquals(List.of(new ProviderHealthChangedEvent("p1", HealthStatus.OPTIMAL, HealthStatus.OFFLINE)),
                    events.eventsOf(ProviderHealthChangedEvent.class));
        }
    }

    @Test
    @DisplayName("Reset statistics followed by a success should leave a clean OPTIMAL record")
    void resetThenSuccess() {
        tracker.recordAttempt("p1", false, 10);
        tracker.recordAttempt("p1", false, 10);

        tracker.resetStatistics("p1");
        tracker.recordAttempt("p1", true, 40);

        final ProviderStatus status = status();
        assertEquals(HealthStatus.OPTIMAL, status.getHealth());
        assertEquals(1, status.getTotalAttempts());
        assertEquals(0, status.getFailedAttempts());
        assertEquals(20, status.getAverageResponseTimeMs());
    }

    @Test
    @DisplayName("Overall health should follow the share of available providers")
    void overallHealthFollowsShare() {
        tracker.track("p2");
        tracker.recordAttempt("p1", true, 10);

        assertEquals(HealthStatus.DEGRADED, tracker.overallHealth());

        tracker.recordAttempt("p2", true, 10);
        assertEquals(HealthStatus.OPTIMAL, tracker.overallHealth());

        tracker.untrack("p1");
        tracker.untrack("p2");
        assertEquals(HealthStatus.OFFLINE, tracker.overallHealth());
    }
}
