package com.eyelevel.paperprocessor.common.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Throttles requests so that no more than {@code requestsPerSecond} are issued in any trailing window.
 * <p>
 * For rates of one or more per second the window is one second and holds {@code floor(requestsPerSecond)}
 * requests. Slower rates keep one request per window of {@code 1 / requestsPerSecond} seconds.
 * The history is inspected and updated under a lock; waiting happens outside it.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    private final int permitsPerWindow;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SlidingWindowRateLimiter(double requestsPerSecond, Clock clock, Sleeper sleeper) {
        if (!(requestsPerSecond > 0)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        if (requestsPerSecond >= 1) {
            this.permitsPerWindow = (int) Math.floor(requestsPerSecond);
            this.window = Duration.ofSeconds(1);
        } else {
            this.permitsPerWindow = 1;
            this.window = Duration.ofNanos(Math.round(1_000_000_000L / requestsPerSecond));
        }
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until one more request fits into the trailing window, then records it.
     *
     * @throws InterruptedException if the thread is interrupted while waiting; nothing is recorded.
     */
    public void acquire() throws InterruptedException {
        while (true) {
            Duration wait;
            lock.lock();
            try {
                Instant now = clock.instant();
                prune(now);
                if (history.size() < permitsPerWindow) {
                    history.addLast(now);
                    return;
                }
                wait = Duration.between(now, history.peekFirst().plus(window));
            } finally {
                lock.unlock();
            }
            log.debug("Rate limit of {} per {} ms reached, waiting {} ms.", permitsPerWindow, window.toMillis(),
                    wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    /**
     * @return the number of requests recorded inside the window ending now.
     */
    public int recentRequests() {
        lock.lock();
        try {
            prune(clock.instant());
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    public int getPermitsPerWindow() {
        return permitsPerWindow;
    }

    public Duration getWindow() {
        return window;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!history.isEmpty() && !history.peekFirst().isAfter(cutoff)) {
            history.removeFirst();
        }
    }
}
