package com.eventsync.infrastructure.scraper;

import com.eventsync.domain.model.CancellationToken;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RobotsPolicy.
 */
class RobotsPolicyTest {

    @Test
    void testRobotName() {
        assertEquals("eventsync-scraper", RobotsPolicy.robotName("EventSync-Scraper/0.1 (+https://eventsync.example)"));
        assertEquals("crawler", RobotsPolicy.robotName("Crawler (compatible)"));
        assertEquals("bot", RobotsPolicy.robotName("bot"));
    }

    @Test
    void testRobotsUrlKeepsSchemeAndPort() {
        assertEquals("https://example.org/robots.txt", RobotsPolicy.robotsUrlFor("https://example.org/events?page=2"));
        assertEquals("http://localhost:8081/robots.txt", RobotsPolicy.robotsUrlFor("http://localhost:8081/a/b"));
    }

    @Test
    void testMissingRobotsAllowsEverything() throws IOException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().status("https://example.org/robots.txt", 404);
        RobotsPolicy policy = new RobotsPolicy(fetcher);

        assertTrue(policy.isAllowed("https://example.org/private/page", CancellationToken.none()));
    }

    @Test
    void testGoneRobotsAllowsEverything() throws IOException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().status("https://example.org/robots.txt", 410);

        assertTrue(new RobotsPolicy(fetcher).isAllowed("https://example.org/x", CancellationToken.none()));
    }

    @Test
    void testServerErrorIsPermissive() throws IOException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().status("https://example.org/robots.txt", 503);

        assertTrue(new RobotsPolicy(fetcher).isAllowed("https://example.org/x", CancellationToken.none()));
    }

    @Test
    void testDisallowRulesForOurAgent() throws IOException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().text("https://example.org/robots.txt",
            "User-agent: testbot\nDisallow: /private\n\nUser-agent: *\nDisallow: /\n");
        RobotsPolicy policy = new RobotsPolicy(fetcher);

        assertFalse(policy.isAllowed("https://example.org/private/page", CancellationToken.none()));
        assertTrue(policy.isAllowed("https://example.org/events", CancellationToken.none()));
    }

    @Test
    void testWildcardRulesApplyWhenAgentNotNamed() throws IOException {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().text("https://example.org/robots.txt",
            "User-agent: *\nDisallow: /admin\n");
        RobotsPolicy policy = new RobotsPolicy(fetcher);

        assertFalse(policy.isAllowed("https://example.org/admin/login", CancellationToken.none()));
        assertTrue(policy.isAllowed("https://example.org/events", CancellationToken.none()));
    }

    @Test
    void testNetworkErrorPropagates() {
        FakeHttpFetcher fetcher = new FakeHttpFetcher().failing("https://example.org/robots.txt");

        assertThrows(IOException.class,
            () -> new RobotsPolicy(fetcher).fetchRules("https://example.org/events", CancellationToken.none()));
    }
}
