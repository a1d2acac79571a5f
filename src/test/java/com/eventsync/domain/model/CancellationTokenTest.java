package com.eventsync.domain.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CancellationToken.
 */
class CancellationTokenTest {

    @Test
    void testListenersRunOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testListenerOnCancelledTokenRunsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        CancellationToken.cancelled().onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testRemovedListenerDoesNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();

        try (CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet)) {
            assertFalse(token.isCancelled());
        }
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void testNoneIsNeverCancelled() {
        CancellationToken.none().cancel();

        assertFalse(CancellationToken.none().isCancelled());
    }
}
