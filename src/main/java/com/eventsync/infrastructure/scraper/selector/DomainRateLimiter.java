package com.eventsync.infrastructure.scraper.selector;

import com.eventsync.domain.model.CancellationToken;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum delay between two fetches to the same host.
 */
public class DomainRateLimiter {

    private final Map<String, Long> nextAllowedAt = new HashMap<>();
    private final LongSupplier clock;
    private long delayMillis;

    public DomainRateLimiter(Duration delay) {
        this(delay, System::currentTimeMillis);
    }

    DomainRateLimiter(Duration delay, LongSupplier clock) {
        this.delayMillis = Math.max(0, delay.toMillis());
        this.clock = clock;
    }

    /**
     * Raises the delay, e.g. to honour a robots.txt Crawl-delay. Never lowers it.
     */
    public synchronized void raiseDelay(Duration delay) {
        delayMillis = Math.max(delayMillis, delay.toMillis());
    }

    public synchronized long getDelayMillis() {
        return delayMillis;
    }

    /**
     * Blocks until a fetch to {@code host} is allowed and reserves the slot.
     *
     * @return false if the wait was interrupted or the token fired while waiting
     */
    public boolean acquire(String host, CancellationToken token) {
        long waitMillis;
        synchronized (this) {
            long now = clock.getAsLong();
            long slot = Math.max(now, nextAllowedAt.getOrDefault(host, now));
            nextAllowedAt.put(host, slot + delayMillis);
            waitMillis = slot - now;
        }
        long deadline = System.currentTimeMillis() + waitMillis;
        while (waitMillis > 0) {
            if (token.isCancelled()) {
                return false;
            }
            try {
                Thread.sleep(Math.min(waitMillis, 100));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            waitMillis = deadline - System.currentTimeMillis();
        }
        return !token.isCancelled();
    }
}
