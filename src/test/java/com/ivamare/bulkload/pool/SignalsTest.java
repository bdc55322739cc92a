package com.ivamare.bulkload.pool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Signals")
class SignalsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private WorkItem<Span> a;
    private WorkItem<Span> b;
    private WorkItem<Span> c;
    private Signals<Span> signals;

    @BeforeEach
    void setUp() {
        a = WorkItem.of(new Span(0, 1), 0, TIMEOUT);
        b = WorkItem.of(new Span(1, 2), 0, TIMEOUT);
        c = WorkItem.of(new Span(2, 3), 0, TIMEOUT);
        signals = new Signals<>("test", List.of(a, b));
        signals.bindOwner(Thread.currentThread());
    }

    @Nested
    @DisplayName("dispatch and land")
    class DispatchTests {

        @Test
        @DisplayName("should dispatch in FIFO order")
        void shouldDispatchInFifoOrder() {
            assertSame(a, signals.dispatch());
            assertSame(b, signals.dispatch());
            assertNull(signals.dispatch());
            assertEquals(2, signals.inFlight());
        }

        @Test
        @DisplayName("should move an item from in flight to landed")
        void shouldMoveItemFromInFlightToLanded() {
            WorkItem<Span> item = signals.dispatch();
            signals.land(new WorkResult<>(item, Outcome.success(null)));

            SignalsSnapshot<Span> now = signals.snapshot();
            assertEquals(0, now.inFlight());
            assertEquals(1, now.landed());
            assertEquals(1, now.peakInFlight());
            assertEquals(List.of(b), now.pending());
        }

        @Test
        @DisplayName("should count follow-ups in total enqueued")
        void shouldCountFollowUpsInTotalEnqueued() {
            signals.enqueue(List.of(c));

            SignalsSnapshot<Span> now = signals.snapshot();
            assertEquals(3, now.totalEnqueued());
            assertEquals(List.of(a, b, c), now.pending());
        }
    }

    @Nested
    @DisplayName("shutdown bookkeeping")
    class ShutdownTests {

        @Test
        @DisplayName("should move pending items to cancelled")
        void shouldMovePendingItemsToCancelled() {
            signals.dispatch();

            assertEquals(1, signals.cancelPending());

            SignalsSnapshot<Span> now = signals.snapshot();
            assertTrue(now.pending().isEmpty());
            assertEquals(List.of(b), now.cancelled());
            assertEquals(now.totalEnqueued(), now.pending().size() + now.inFlight() + now.landed() + now.cancelled().size());
        }

        @Test
        @DisplayName("should list failed items before cancelled ones for retry")
        void shouldListFailedItemsBeforeCancelledOnesForRetry() {
            WorkItem<Span> item = signals.dispatch();
            WorkResult<Span> failure = new WorkResult<>(item, Outcome.error(new IllegalStateException("x")));
            signals.land(failure);
            signals.recordFailure(failure);
            signals.cancelPending();

            assertEquals(List.of(a, b), signals.snapshot().retryItems());
        }

        @Test
        @DisplayName("should record elapsed time once terminal")
        void shouldRecordElapsedTimeOnceTerminal() throws InterruptedException {
            signals.transition(PoolState.COMPLETED);
            Duration first = signals.snapshot().elapsed();
            Thread.sleep(20);

            assertEquals(first, signals.snapshot().elapsed());
        }
    }

    @Nested
    @DisplayName("counters")
    class CounterTests {

        @Test
        @DisplayName("should add to counters starting at zero")
        void shouldAddToCountersStartingAtZero() {
            assertEquals(0, signals.counter("rows:t"));
            signals.increment("rows:t", 5);
            signals.increment("rows:t", 7);

            assertEquals(12, signals.counter("rows:t"));
            assertEquals(12, signals.snapshot().counter("rows:t"));
        }

        @Test
        @DisplayName("should reject updates from a thread other than the owner")
        void shouldRejectUpdatesFromThreadOtherThanOwner() throws InterruptedException {
            CompletableFuture<Long> update = CompletableFuture.supplyAsync(() -> signals.increment("x", 1));

            ExecutionException ex = assertThrows(ExecutionException.class, update::get);
            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertEquals(0, signals.counter("x"));
        }

        @Test
        @DisplayName("should allow reads from any thread")
        void shouldAllowReadsFromAnyThread() throws Exception {
            signals.increment("x", 3);

            assertEquals(3L, CompletableFuture.supplyAsync(() -> signals.counter("x")).get());
        }
    }
}
