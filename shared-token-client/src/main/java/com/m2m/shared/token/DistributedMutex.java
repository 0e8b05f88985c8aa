package com.m2m.shared.token;

public interface DistributedMutex {

    /**
     * Never blocks waiting for another holder.
     *
     * @return true iff the caller now holds {@code key}
     */
    boolean tryAcquire(String key);

    /**
     * Releases {@code key} if the caller holds it; otherwise does nothing.
     */
    void release(String key);
}
