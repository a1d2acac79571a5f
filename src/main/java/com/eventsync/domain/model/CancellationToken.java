package com.eventsync.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation signal shared by fetch, crawl and orchestration.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run once, on the thread
 * that calls {@link #cancel()}, or immediately when the token is already cancelled.
 * They are used to abort in-flight HTTP requests.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            // shared instance, never cancelled
        }

        @Override
        public Registration onCancel(Runnable listener) {
            return () -> { };
        }
    };

    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * A token that never fires.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        return token;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            runQuietly(listener);
        }
    }

    /**
     * Registers a callback to run on cancellation. Returns a handle that removes it.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (listeners) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        runQuietly(listener);
        return () -> { };
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
