package com.intention.retry;

import java.time.Duration;

/**
 * Blocking pause between attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
