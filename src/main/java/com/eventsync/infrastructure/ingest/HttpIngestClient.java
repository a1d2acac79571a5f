package com.eventsync.infrastructure.ingest;

import com.eventsync.domain.exception.IngestException;
import com.eventsync.domain.exception.RateLimitedException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.EventInput;
import com.eventsync.domain.model.IngestResult;
import com.eventsync.domain.ports.IngestGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Submits events to {@code POST {base}/api/v1/events:batch}.
 *
 * <p>Large submissions are split into chunks of {@value #MAX_BATCH_SIZE}; the
 * per-chunk results are summed. Nothing is retried. Cancelling the token stops
 * the submission before the next chunk and aborts the one in flight.
 */
public class HttpIngestClient implements IngestGateway, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpIngestClient.class);

    static final int MAX_BATCH_SIZE = 100;
    static final String BATCH_PATH = "/api/v1/events:batch";
    static final int MAX_SNIPPET_LENGTH = 200;

    private final String batchUrl;
    private final String apiKey;
    private final String userAgent;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    public HttpIngestClient(String baseUrl, String apiKey, String userAgent, Duration timeout,
                            ObjectMapper objectMapper) {
        this.batchUrl = stripTrailingSlash(baseUrl) + BATCH_PATH;
        this.apiKey = apiKey;
        this.userAgent = userAgent;
        this.objectMapper = objectMapper;
        Timeout httpTimeout = Timeout.ofMilliseconds(timeout.toMillis());
        this.httpClient = HttpClients.custom()
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(httpTimeout)
                .setResponseTimeout(httpTimeout)
                .build())
            .disableRedirectHandling()
            .disableAutomaticRetries()
            .build();
    }

    public String getBatchUrl() {
        return batchUrl;
    }

    @Override
    public IngestResult submitBatch(List<EventInput> events, CancellationToken token) throws IngestException {
        if (events == null || events.isEmpty()) {
            return IngestResult.empty();
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IngestException("no ingest API key configured (scraper.ingest.api-key)", null);
        }

        IngestResult total = IngestResult.empty();
        for (int start = 0; start < events.size(); start += MAX_BATCH_SIZE) {
            if (token.isCancelled()) {
                throw new IngestException("submission cancelled after " + start + " of " + events.size()
                    + " events", null);
            }
            List<EventInput> chunk = events.subList(start, Math.min(start + MAX_BATCH_SIZE, events.size()));
            IngestResult chunkResult = postChunk(chunk, token);
            logger.info("Submitted {} events to {}: batch={} created={} duplicate={} failed={}",
                chunk.size(), batchUrl, chunkResult.batchId(), chunkResult.eventsCreated(),
                chunkResult.eventsDuplicate(), chunkResult.eventsFailed());
            total = total.plus(chunkResult, start);
        }
        return total;
    }

    @Override
    public IngestResult submitBatchDryRun(List<EventInput> events) {
        int count = events == null ? 0 : events.size();
        logger.info("Dry run: {} events not submitted", count);
        return IngestResult.dryRun(count);
    }

    private IngestResult postChunk(List<EventInput> chunk, CancellationToken token) throws IngestException {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(Map.of("events", chunk));
        } catch (JsonProcessingException e) {
            throw new IngestException("marshal batch: " + e.getOriginalMessage(), e);
        }

        HttpPost request = new HttpPost(batchUrl);
        request.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);
        request.setEntity(new ByteArrayEntity(payload, ContentType.APPLICATION_JSON));

        String responseBody;
        int statusCode;
        try (CancellationToken.Registration ignored = token.onCancel(request::cancel);
             CloseableHttpResponse response = httpClient.execute(request)) {
            statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            responseBody = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (ParseException e) {
            throw new IngestException("read response: " + e.getMessage(), e);
        } catch (IOException e) {
            if (token.isCancelled()) {
                throw new IngestException("submission cancelled", e);
            }
            throw new IngestException("send request: " + e.getMessage(), e);
        }

        if (statusCode == 429) {
            throw new RateLimitedException(snippet(responseBody));
        }
        if (statusCode < 200 || statusCode >= 300) {
            String snippet = snippet(responseBody);
            logger.error("Batch submission failed with status {}: {}", statusCode, snippet);
            throw new IngestException("unexpected status " + statusCode + ": " + snippet, statusCode, snippet);
        }

        try {
            return objectMapper.readValue(responseBody, IngestResult.class);
        } catch (JsonProcessingException e) {
            throw new IngestException("parse response: " + e.getOriginalMessage(), e);
        }
    }

    static String snippet(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_SNIPPET_LENGTH ? body.substring(0, MAX_SNIPPET_LENGTH) : body;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url == null ? "" : url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
