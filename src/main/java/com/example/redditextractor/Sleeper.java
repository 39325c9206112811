package com.example.redditextractor;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Blocks the calling thread.
     */
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}
