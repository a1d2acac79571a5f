package com.eventsync.infrastructure.scraper;

import com.eventsync.domain.model.CancellationToken;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory fetcher for tests. Unknown URLs answer 404; URLs registered with
 * {@link #failing(String)} throw an IOException.
 */
public class FakeHttpFetcher extends HttpFetcher {

    private final Map<String, FetchedPage> pages = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());
    private Runnable onFetch = () -> { };

    public FakeHttpFetcher() {
        super("TestBot/1.0 (+https://test.example)");
    }

    public FakeHttpFetcher html(String url, String html) {
        pages.put(url, new FetchedPage(url, 200, "text/html; charset=UTF-8", html.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public FakeHttpFetcher text(String url, String body) {
        pages.put(url, new FetchedPage(url, 200, "text/plain", body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public FakeHttpFetcher status(String url, int statusCode) {
        pages.put(url, new FetchedPage(url, statusCode, "text/html", new byte[0]));
        return this;
    }

    public FakeHttpFetcher failing(String url) {
        failing.add(url);
        return this;
    }

    /**
     * Runs before every fetch, e.g. to cancel a token mid-crawl.
     */
    public FakeHttpFetcher onFetch(Runnable action) {
        this.onFetch = action;
        return this;
    }

    public List<String> getRequested() {
        synchronized (requested) {
            return new ArrayList<>(requested);
        }
    }

    public List<String> getRequestedPages() {
        List<String> result = new ArrayList<>();
        for (String url : getRequested()) {
            if (!url.endsWith("/robots.txt")) {
                result.add(url);
            }
        }
        return result;
    }

    @Override
    public FetchedPage get(String url, Duration timeout, int maxBytes, CancellationToken token) throws IOException {
        requested.add(url);
        onFetch.run();
        if (token.isCancelled()) {
            throw new IOException("request cancelled");
        }
        if (failing.contains(url)) {
            throw new IOException("connection refused");
        }
        FetchedPage page = pages.get(url);
        return page != null ? page : new FetchedPage(url, 404, "text/plain", new byte[0]);
    }
}
