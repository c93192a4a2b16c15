package com.purchasingpower.research.util;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
