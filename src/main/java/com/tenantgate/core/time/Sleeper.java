package com.tenantgate.core.time;

import java.time.Duration;

/**
 * Blocking pause used by polling and backoff loops; replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
