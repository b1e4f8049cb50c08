package br.edu.ifba.meetingrag.utils;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts. Tests swap in a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
