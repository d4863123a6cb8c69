package ua.beengoo.rolink.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionStoreTest {
    private static final String VERIFIER = "v".repeat(86);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
    private final InMemorySessionStore store = new InMemorySessionStore(Duration.ofSeconds(600), clock);

    @Test
    void createAndConsume() {
        store.create("abc", 42L, 7L, VERIFIER);

        var st = store.consume("abc").orElseThrow();
        assertEquals(42L, st.requesterId());
        assertEquals(7L, st.tenantId());
        assertEquals(VERIFIER, st.codeVerifier());
        assertEquals(clock.instant(), st.createdAt());
    }

    @Test
    void secondConsumeIsEmpty() {
        store.create("abc", 42L, 7L, VERIFIER);
        assertTrue(store.consume("abc").isPresent());
        assertTrue(store.consume("abc").isEmpty());
    }

    @Test
    void unknownAndNullStatesAreEmpty() {
        assertTrue(store.consume("unknown").isEmpty());
        assertTrue(store.consume(null).isEmpty());
    }

    @Test
    void expiredSessionIsNotObservable() {
        store.create("abc", 42L, 7L, VERIFIER);
        clock.advance(Duration.ofSeconds(601));
        assertTrue(store.consume("abc").isEmpty());
    }

    @Test
    void sessionJustBeforeExpiryIsStillValid() {
        store.create("abc", 42L, 7L, VERIFIER);
        clock.advance(Duration.ofSeconds(599));
        assertTrue(store.consume("abc").isPresent());
    }

    @Test
    void pruneRemovesOnlyExpired() {
        store.create("old", 1L, 0L, VERIFIER);
        clock.advance(Duration.ofSeconds(400));
        store.create("new", 2L, 0L, VERIFIER);
        clock.advance(Duration.ofSeconds(300));

        assertEquals(1, store.pruneExpired());
        assertEquals(1, store.size());
        assertTrue(store.consume("new").isPresent());
    }

    @Test
    void rejectsMalformedSessions() {
        assertThrows(IllegalArgumentException.class, () -> store.create("abc", 1L, 0L, "short"));
        assertThrows(IllegalArgumentException.class, () -> store.create("abc", 1L, 0L, "x".repeat(129)));
        assertThrows(IllegalArgumentException.class, () -> store.create(" ", 1L, 0L, VERIFIER));
    }

    @Test
    void concurrentConsumeHasExactlyOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int round = 0; round < 50; round++) {
                String state = "state-" + round;
                store.create(state, 42L, 7L, VERIFIER);

                CountDownLatch start = new CountDownLatch(1);
                AtomicInteger winners = new AtomicInteger();
                var futures = new java.util.ArrayList<Future<?>>();
                for (int i = 0; i < threads; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        if (store.consume(state).isPresent()) winners.incrementAndGet();
                        return null;
                    }));
                }
                start.countDown();
                for (var f : futures) f.get(5, TimeUnit.SECONDS);
                assertEquals(1, winners.get(), "round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
