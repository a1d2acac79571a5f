package com.eventsync.infrastructure.ingest;

import com.eventsync.domain.exception.IngestException;
import com.eventsync.domain.exception.RateLimitedException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.EventInput;
import com.eventsync.domain.model.IngestResult;
import com.eventsync.domain.model.SourceInput;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpIngestClient against an in-process HTTP server.
 */
class HttpIngestClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<JsonNode> requestBodies = Collections.synchronizedList(new ArrayList<>());
    private final List<String> authHeaders = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger requestCount = new AtomicInteger();

    private HttpServer server;
    private volatile int responseStatus = 200;
    private volatile String fixedResponse;
    private volatile Runnable onRequest = () -> { };

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/events:batch", this::handle);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestCount.incrementAndGet();
        onRequest.run();
        authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
        JsonNode body = objectMapper.readTree(exchange.getRequestBody());
        requestBodies.add(body);

        String response = fixedResponse;
        if (response == null) {
            int size = body.get("events").size();
            response = "{\"batch_id\":\"b" + requestCount.get() + "\",\"events_created\":" + (size - 1)
                + ",\"events_duplicate\":1,\"events_failed\":0,"
                + "\"errors\":[{\"index\":0,\"message\":\"bad date\"}]}";
        }
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(responseStatus, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpIngestClient client(String apiKey) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new HttpIngestClient(baseUrl, apiKey, "TestBot/1.0", Duration.ofSeconds(5), objectMapper);
    }

    private static List<EventInput> events(int count) {
        List<EventInput> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(EventInput.builder()
                .name("Event " + i)
                .startDate("2025-06-01")
                .source(new SourceInput("https://venue.example", "e" + i, "venue", null))
                .build());
        }
        return events;
    }

    @Test
    void testBaseUrlTrailingSlashIsStripped() throws IOException {
        try (HttpIngestClient client = new HttpIngestClient("https://api.example//", "k", "ua",
                Duration.ofSeconds(1), objectMapper)) {
            assertEquals("https://api.example/api/v1/events:batch", client.getBatchUrl());
        }
    }

    @Test
    void testLargeSubmissionIsChunkedAndSummed() throws Exception {
        try (HttpIngestClient client = client("secret")) {
            IngestResult result = client.submitBatch(events(150), CancellationToken.none());

            assertEquals(2, requestCount.get());
            assertEquals(100, requestBodies.get(0).get("events").size());
            assertEquals(50, requestBodies.get(1).get("events").size());
            assertEquals("Event 100", requestBodies.get(1).get("events").get(0).get("name").asText());

            assertEquals(148, result.eventsCreated());
            assertEquals(2, result.eventsDuplicate());
            assertEquals(0, result.eventsFailed());
            assertEquals("b2", result.batchId());
            // error indexes are relative to the whole submission
            assertEquals(List.of(0, 100), result.errors().stream().map(e -> e.index()).toList());
            assertEquals(List.of("Bearer secret", "Bearer secret"), authHeaders);
        }
    }

    @Test
    void testDryRunMakesNoRequest() throws Exception {
        try (HttpIngestClient client = client("secret")) {
            IngestResult result = client.submit(events(3), true, CancellationToken.none());

            assertEquals(0, requestCount.get());
            assertEquals(IngestResult.DRY_RUN_BATCH_ID, result.batchId());
            assertEquals(3, result.eventsCreated());
        }
    }

    @Test
    void testEmptySubmissionMakesNoRequest() throws Exception {
        try (HttpIngestClient client = client("secret")) {
            IngestResult result = client.submitBatch(List.of(), CancellationToken.none());

            assertEquals(0, requestCount.get());
            assertEquals(0, result.eventsCreated());
        }
    }

    @Test
    void testMissingApiKey() throws IOException {
        try (HttpIngestClient client = client(" ")) {
            assertThrows(IngestException.class, () -> client.submitBatch(events(1), CancellationToken.none()));
            assertEquals(0, requestCount.get());
        }
    }

    @Test
    void testRateLimited() throws IOException {
        responseStatus = 429;
        fixedResponse = "{\"error\":\"slow down\"}";

        try (HttpIngestClient client = client("secret")) {
            RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> client.submitBatch(events(1), CancellationToken.none()));
            assertEquals(429, e.getStatusCode());
            assertTrue(e.getBodySnippet().contains("slow down"));
        }
    }

    @Test
    void testServerErrorCarriesStatusAndSnippet() throws IOException {
        responseStatus = 500;
        fixedResponse = "x".repeat(1000);

        try (HttpIngestClient client = client("secret")) {
            IngestException e = assertThrows(IngestException.class,
                () -> client.submitBatch(events(150), CancellationToken.none()));
            assertFalse(e instanceof RateLimitedException);
            assertEquals(500, e.getStatusCode());
            assertEquals(HttpIngestClient.MAX_SNIPPET_LENGTH, e.getBodySnippet().length());
            // the first failing chunk stops the submission
            assertEquals(1, requestCount.get());
        }
    }

    @Test
    void testUnparseableSuccessBody() throws IOException {
        fixedResponse = "<html>ok</html>";

        try (HttpIngestClient client = client("secret")) {
            assertThrows(IngestException.class, () -> client.submitBatch(events(1), CancellationToken.none()));
        }
    }

    @Test
    void testUnreachableServer() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        try (HttpIngestClient client = new HttpIngestClient("http://127.0.0.1:" + closedPort, "secret",
                "TestBot/1.0", Duration.ofSeconds(2), objectMapper)) {
            IngestException e = assertThrows(IngestException.class,
                () -> client.submitBatch(events(1), CancellationToken.none()));
            assertEquals(-1, e.getStatusCode());
        }
    }

    @Test
    void testCancellationStopsRemainingChunks() throws IOException {
        CancellationToken token = new CancellationToken();
        onRequest = token::cancel;

        try (HttpIngestClient client = client("secret")) {
            assertThrows(IngestException.class, () -> client.submitBatch(events(250), token));
            assertEquals(1, requestCount.get());
        }
    }

    @Test
    void testCancelledTokenMakesNoRequest() throws IOException {
        try (HttpIngestClient client = client("secret")) {
            IngestException e = assertThrows(IngestException.class,
                () -> client.submitBatch(events(1), CancellationToken.cancelled()));
            assertTrue(e.getMessage().contains("cancelled"));
            assertEquals(0, requestCount.get());
        }
    }
}
