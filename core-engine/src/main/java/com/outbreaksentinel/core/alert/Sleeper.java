package com.outbreaksentinel.core.alert;

import java.time.Duration;

/**
 * Pause between persistence retries; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
