package com.reclaimradar.common;

/**
 * Blocking pause between provider polls and retries. Tests substitute a no-op.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    Sleeper THREAD = Thread::sleep;
}
