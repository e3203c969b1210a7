package com.relevx.common;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-user mutual exclusion inside one process. Locks are weakly held and disappear once no thread uses them.
 */
@Component
public class UserLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(userId -> new ReentrantLock());

    public <T> T withLock(String userId, Supplier<T> action) {
        ReentrantLock lock = locks.get(userId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    boolean isLocked(String userId) {
        ReentrantLock lock = locks.getIfPresent(userId);
        return lock != null && lock.isLocked();
    }
}
