package com.purchasingpower.fullcycle.util;

import com.purchasingpower.fullcycle.exception.PipelineException;

import java.time.Duration;

/**
 * Blocking pause used by backoff and polling loops; replaced by a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper threadSleep() {
        return duration -> {
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException("Interrupted while waiting " + duration, e);
            }
        };
    }
}
