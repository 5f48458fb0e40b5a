package com.yerin.retry.infra;

/**
 * Blocks the calling thread between attempts.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
