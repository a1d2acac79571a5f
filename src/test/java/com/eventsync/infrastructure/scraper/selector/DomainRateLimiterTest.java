package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.model.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DomainRateLimiter.
 */
class DomainRateLimiterTest {

    @Test
    void testFirstAcquireDoesNotWait() {
        DomainRateLimiter limiter = new DomainRateLimiter(Duration.ofSeconds(30));

        long start = System.nanoTime();
        assertTrue(limiter.acquire("venue.example", CancellationToken.none()));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1000);
    }

    @Test
    void testSecondAcquireWaitsForDelay() {
        DomainRateLimiter limiter = new DomainRateLimiter(Duration.ofMillis(150));

        long start = System.nanoTime();
        assertTrue(limiter.acquire("venue.example", CancellationToken.none()));
        assertTrue(limiter.acquire("venue.example", CancellationToken.none()));
        long elapsed = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsed >= 140, "waited only " + elapsed + " ms");
    }

    @Test
    void testHostsAreIndependent() {
        AtomicLong now = new AtomicLong(1_000);
        DomainRateLimiter limiter = new DomainRateLimiter(Duration.ofSeconds(60), now::get);

        long start = System.nanoTime();
        assertTrue(limiter.acquire("a.example", CancellationToken.none()));
        assertTrue(limiter.acquire("b.example", CancellationToken.none()));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 1000);
    }

    @Test
    void testCancelledWhileWaiting() {
        DomainRateLimiter limiter = new DomainRateLimiter(Duration.ofSeconds(60));
        assertTrue(limiter.acquire("venue.example", CancellationToken.none()));

        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        assertFalse(limiter.acquire("venue.example", token));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 5000);
    }

    @Test
    void testRaiseDelayNeverLowers() {
        DomainRateLimiter limiter = new DomainRateLimiter(Duration.ofSeconds(2));

        limiter.raiseDelay(Duration.ofSeconds(1));
        assertEquals(2000, limiter.getDelayMillis());

        limiter.raiseDelay(Duration.ofSeconds(5));
        assertEquals(5000, limiter.getDelayMillis());
    }
}
