package com.streamfirst.seed.ports;

import java.time.Duration;

/**
 * Port for a distributed, lease-based mutex shared by every instance of the application.
 * A lease that is not released within its timeout is considered abandoned and may be taken
 * over by another instance.
 */
public interface MutexPort {

    /**
     * Attempts to acquire the named mutex without waiting.
     *
     * @param collection the collection holding the mutex record
     * @param key the mutex name
     * @param timeout how long the lease stays valid if it is never released
     * @return true if this caller now holds the mutex; false if another holder has a live lease
     *         or the lock backend could not be reached
     */
    boolean tryEnter(String collection, String key, Duration timeout);

    /**
     * Releases the named mutex. Releasing a mutex that is not held is a no-op.
     *
     * @param collection the collection holding the mutex record
     * @param key the mutex name
     */
    void leave(String collection, String key);
}
