package com.ekkalavya.artraining.concurrent;

import com.ekkalavya.artraining.config.TrainingEngineProperties;
import com.ekkalavya.artraining.exception.SessionLockException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionLockManager Tests")
class SessionLockManagerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SessionLockManager manager(int stripes, long timeoutMs) {
        TrainingEngineProperties properties = new TrainingEngineProperties();
        properties.getLocking().setStripes(stripes);
        properties.getLocking().setTimeoutMs(timeoutMs);
        return new SessionLockManager(properties);
    }

    @Test
    @DisplayName("Writes to one session never overlap")
    void shouldSerializeSameSession() throws Exception {
        SessionLockManager lockManager = manager(64, 5000);
        UUID sessionId = UUID.randomUUID();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        AtomicInteger counter = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(executor.submit(() -> {
                for (int j = 0; j < 50; j++) {
                    lockManager.runWithLock(sessionId, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        counter.set(counter.get() + 1);
                        inside.decrementAndGet();
                    });
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(maxInside).hasValue(1);
        assertThat(counter).hasValue(400);
        assertThat(lockManager.isLocked(sessionId)).isFalse();
    }

    @Test
    @DisplayName("Nested calls for the same session re-enter")
    void shouldBeReentrant() {
        SessionLockManager lockManager = manager(64, 100);
        UUID sessionId = UUID.randomUUID();

        String result = lockManager.executeWithLock(sessionId,
                () -> lockManager.executeWithLock(sessionId, () -> "nested"));

        assertThat(result).isEqualTo("nested");
        assertThat(lockManager.isLocked(sessionId)).isFalse();
    }

    @Test
    @DisplayName("Waiting past the timeout fails with SessionLockException")
    void shouldTimeOut() throws Exception {
        SessionLockManager lockManager = manager(1, 50);
        UUID holder = UUID.randomUUID();
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holding = executor.submit(() -> lockManager.runWithLock(holder, () -> {
            acquired.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        // single stripe, so any other session contends for the same lock
        assertThatThrownBy(() -> lockManager.executeWithLock(UUID.randomUUID(), () -> "never"))
                .isInstanceOf(SessionLockException.class)
                .hasMessageContaining("Timed out");

        release.countDown();
        holding.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Lock is released when the operation throws")
    void shouldReleaseOnFailure() {
        SessionLockManager lockManager = manager(64, 100);
        UUID sessionId = UUID.randomUUID();

        assertThatThrownBy(() -> lockManager.runWithLock(sessionId, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockManager.isLocked(sessionId)).isFalse();
    }
}
