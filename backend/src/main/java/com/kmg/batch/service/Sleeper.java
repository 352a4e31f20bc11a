package com.kmg.batch.service;

import java.time.Duration;

/**
 * Blocking pause between gateway calls and between jobs.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
