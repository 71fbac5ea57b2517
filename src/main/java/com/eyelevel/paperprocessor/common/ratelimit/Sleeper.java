package com.eyelevel.paperprocessor.common.ratelimit;

import java.time.Duration;

/**
 * Suspends the calling thread. Abstracted so rate limiting can be tested against a simulated clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(Math.max(1, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
