package com.eyelevel.paperprocessor.common.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies the trailing-window bound against a simulated clock.
 */
class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper advancingSleeper = duration -> {
        sleeps.add(duration);
        clock.advance(duration);
    };

    @Test
    void acquire_neverAdmitsMoreThanRatePerTrailingSecond() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(2.0, clock, advancingSleeper);
        List<Instant> admitted = new ArrayList<>();

        for (int i = 0; i < 9; i++) {
            limiter.acquire();
            admitted.add(clock.instant());
            clock.advance(Duration.ofMillis(50));
        }

        for (Instant start : admitted) {
            long inWindow = admitted.stream()
                    .filter(t -> !t.isBefore(start) && t.isBefore(start.plusSeconds(1)))
                    .count();
            assertTrue(inWindow <= 2, "window starting at " + start + " admitted " + inWindow);
        }
        assertTrue(!sleeps.isEmpty());
    }

    @Test
    void acquire_firstRequestsInBurstDoNotWait() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3.0, clock, advancingSleeper);

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertTrue(sleeps.isEmpty());
        assertEquals(3, limiter.recentRequests());
    }

    @Test
    void acquire_waitsUntilOldestRequestLeavesWindow() throws InterruptedException {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1.0, clock, advancingSleeper);

        limiter.acquire();
        clock.advance(Duration.ofMillis(300));
        limiter.acquire();

        assertEquals(List.of(Duration.ofMillis(700)), sleeps);
    }

    @Test
    void constructor_fractionalRateUsesLongerWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(0.5, clock, advancingSleeper);

        assertEquals(1, limiter.getPermitsPerWindow());
        assertEquals(Duration.ofSeconds(2), limiter.getWindow());
    }

    @Test
    void constructor_rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0, clock, advancingSleeper));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(-1, clock, advancingSleeper));
    }

    @Test
    void acquire_interruptedWaitRecordsNothing() throws InterruptedException {
        Sleeper interrupting = duration -> {
            throw new InterruptedException("cancelled");
        };
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1.0, clock, interrupting);
        limiter.acquire();

        assertThrows(InterruptedException.class, limiter::acquire);
        assertEquals(1, limiter.recentRequests());
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        synchronized void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public synchronized Instant instant() {
            return now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
