package com.eventsync.infrastructure.scraper;

import com.eventsync.domain.model.CancellationToken;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * GET client shared by robots.txt checks, tier 0 and tier 1 fetches and page inspection.
 *
 * <p>Redirects are never followed, so a page cannot bounce us into a private
 * address range. Bodies are read up to a caller supplied cap.
 */
public class HttpFetcher implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpFetcher.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final Timeout CONNECT_TIMEOUT = Timeout.ofSeconds(10);

    private final CloseableHttpClient httpClient;
    private final String userAgent;

    public HttpFetcher(String userAgent) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(CONNECT_TIMEOUT)
                .build())
            .setMaxConnTotal(20)
            .setMaxConnPerRoute(4)
            .build();
        this.httpClient = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .disableRedirectHandling()
            .disableAutomaticRetries()
            .build();
        this.userAgent = userAgent;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * Performs a GET and returns whatever status the server answered with.
     *
     * @param maxBytes body cap; the rest of the body is discarded
     * @throws IOException on network failure, timeout or cancellation
     */
    public FetchedPage get(String url, Duration timeout, int maxBytes, CancellationToken token) throws IOException {
        HttpGet request = new HttpGet(url);
        request.setHeader(HttpHeaders.USER_AGENT, userAgent);
        request.setHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,*/*;q=0.8");
        request.setConfig(RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
            .build());

        logger.debug("GET {}", url);

        try (CancellationToken.Registration ignored = token.onCancel(request::cancel)) {
            CloseableHttpResponse response = httpClient.execute(request);
            try {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String contentType = null;
                byte[] body = new byte[0];

                if (entity != null) {
                    contentType = entity.getContentType();
                    InputStream in = entity.getContent();
                    if (in != null) {
                        body = in.readNBytes(maxBytes);
                        if (body.length == maxBytes && in.read() != -1) {
                            // Drop the connection instead of draining the rest of the body.
                            logger.debug("Body of {} exceeds {} bytes, truncated", url, maxBytes);
                            request.cancel();
                        }
                    }
                }
                if (contentType == null) {
                    Header header = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);
                    contentType = header != null ? header.getValue() : null;
                }

                if (statusCode >= 400) {
                    logger.debug("GET {} returned status {}", url, statusCode);
                    logResponseBodyPreview(body);
                }
                return new FetchedPage(url, statusCode, contentType, body);
            } finally {
                closeResponse(response, url);
            }
        }
    }

    private static void closeResponse(CloseableHttpResponse response, String url) {
        try {
            response.close();
        } catch (IOException e) {
            logger.debug("Closing response of {} failed: {}", url, e.getMessage());
        }
    }

    private static void logResponseBodyPreview(byte[] body) {
        if (!logger.isDebugEnabled() || body.length == 0) {
            return;
        }
        String text = new String(body, 0, Math.min(body.length, MAX_LOG_BODY_LENGTH), StandardCharsets.UTF_8);
        String preview = body.length > MAX_LOG_BODY_LENGTH ? text + "..." : text;
        logger.debug("Response body preview: {}", preview);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
