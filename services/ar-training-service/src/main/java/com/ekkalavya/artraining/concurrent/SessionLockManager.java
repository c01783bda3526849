package com.ekkalavya.artraining.concurrent;

import com.ekkalavya.artraining.config.TrainingEngineProperties;
import com.ekkalavya.artraining.exception.SessionLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes writes per training session.
 *
 * <p>Sessions hash onto a fixed array of fair reentrant locks, so memory stays bounded
 * no matter how many sessions are seen. Two sessions may share a stripe; that only
 * costs throughput, never correctness. Nested calls for the same session re-enter.
 */
@Slf4j
@Component
public class SessionLockManager {

    private final ReentrantLock[] stripes;
    private final long timeoutMs;

    public SessionLockManager(TrainingEngineProperties properties) {
        int count = Math.max(1, properties.getLocking().getStripes());
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock(true);
        }
        this.timeoutMs = properties.getLocking().getTimeoutMs();
    }

    public <T> T executeWithLock(UUID sessionId, Supplier<T> operation) {
        ReentrantLock lock = lockFor(sessionId);
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out after {}ms waiting for lock on session {}", timeoutMs, sessionId);
                throw new SessionLockException("Timed out acquiring lock for session " + sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionLockException("Interrupted while acquiring lock for session " + sessionId, e);
        }

        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(UUID sessionId, Runnable operation) {
        executeWithLock(sessionId, () -> {
            operation.run();
            return null;
        });
    }

    boolean isLocked(UUID sessionId) {
        return lockFor(sessionId).isLocked();
    }

    private ReentrantLock lockFor(UUID sessionId) {
        int hash = sessionId.hashCode();
        hash ^= (hash >>> 16);
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
