package com.m2m.shared.token;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-JVM mutex. Ownership is tracked by thread so a stray release cannot free someone else's lock.
 */
public class InMemoryDistributedMutex implements DistributedMutex {

    private final ConcurrentMap<String, Thread> owners = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String key) {
        return owners.putIfAbsent(key, Thread.currentThread()) == null;
    }

    @Override
    public void release(String key) {
        owners.remove(key, Thread.currentThread());
    }

    public boolean isHeld(String key) {
        return owners.containsKey(key);
    }
}
