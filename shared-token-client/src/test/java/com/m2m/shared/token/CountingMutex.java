package com.m2m.shared.token;

import java.util.concurrent.atomic.AtomicInteger;

final class CountingMutex implements DistributedMutex {

    final InMemoryDistributedMutex delegate = new InMemoryDistributedMutex();
    final AtomicInteger acquireAttempts = new AtomicInteger();
    final AtomicInteger releases = new AtomicInteger();

    @Override
    public boolean tryAcquire(String key) {
        acquireAttempts.incrementAndGet();
        return delegate.tryAcquire(key);
    }

    @Override
    public void release(String key) {
        releases.incrementAndGet();
        delegate.release(key);
    }
}
