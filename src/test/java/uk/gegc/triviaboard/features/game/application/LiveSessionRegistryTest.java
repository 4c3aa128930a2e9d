package uk.gegc.triviaboard.features.game.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.triviaboard.features.game.domain.model.LiveGameSession;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("LiveSessionRegistry")
class LiveSessionRegistryTest {

    private static final Instant NOW = Instant.parse("2025-05-01T18:00:00Z");

    private final LiveSessionRegistry registry = new LiveSessionRegistry();

    @Test
    @DisplayName("withLock serialises concurrent actions on the same session")
    void withLock_serialises() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    registry.runWithLock(1L, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.lockCount()).isZero();
    }

    @Test
    @DisplayName("a session lock exists only while it is held")
    void withLock_releasesEntry() {
        Integer heldLocks = registry.withLock(1L, () -> registry.lockCount());

        assertThat(heldLocks).isEqualTo(1);
        assertThat(registry.lockCount()).isZero();
    }

    @Test
    @DisplayName("a failing action still releases its lock entry")
    void withLock_releasesEntryOnFailure() {
        for (long id = 1; id <= 1000; id++) {
            long sessionId = id;
            assertThatThrownBy(() -> registry.runWithLock(sessionId, () -> {
                throw new IllegalStateException("unknown session " + sessionId);
            })).isInstanceOf(IllegalStateException.class);
        }

        assertThat(registry.lockCount()).isZero();
    }

    @Test
    @DisplayName("a waiting thread keeps the entry alive until it has run")
    void withLock_waiterSharesEntry() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger order = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> holder = pool.submit(() -> registry.withLock(1L, () -> {
                held.countDown();
                await(release);
                return order.incrementAndGet();
            }));
            held.await(5, TimeUnit.SECONDS);
            Future<Integer> waiter = pool.submit(() -> registry.withLock(1L, order::incrementAndGet));
            release.countDown();

            assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo(1);
            assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
        assertThat(registry.lockCount()).isZero();
    }

    @Test
    @DisplayName("withLock is reentrant for the holding thread")
    void withLock_reentrant() {
        Integer result = registry.withLock(1L, () -> registry.withLock(1L, () -> 42));

        assertThat(result).isEqualTo(42);
    }

    @Test
    @DisplayName("register replaces and closes previous live state")
    void register_closesPrevious() {
        LiveGameSession first = live(1L, NOW);
        ScheduledFuture<?> reveal = mock(ScheduledFuture.class);
        first.setPendingReveal(reveal);
        registry.register(first);

        LiveGameSession second = live(1L, NOW);
        registry.register(second);

        verify(reveal).cancel(false);
        assertThat(registry.find(1L)).containsSame(second);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("discard removes live state")
    void discard_removes() {
        registry.register(live(1L, NOW));

        registry.discard(1L);

        assertThat(registry.find(1L)).isEmpty();
    }

    @Test
    @DisplayName("evictIdle drops only sessions idle since before the cutoff")
    void evictIdle_onlyStale() {
        registry.register(live(1L, NOW.minus(Duration.ofHours(7))));
        registry.register(live(2L, NOW.minus(Duration.ofMinutes(5))));

        int evicted = registry.evictIdle(NOW.minus(Duration.ofHours(6)));

        assertThat(evicted).isEqualTo(1);
        assertThat(registry.find(1L)).isEmpty();
        assertThat(registry.find(2L)).isPresent();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static LiveGameSession live(Long sessionId, Instant lastActivity) {
        return new LiveGameSession(sessionId, 1L, 2, List.of(), 0, lastActivity);
    }
}
