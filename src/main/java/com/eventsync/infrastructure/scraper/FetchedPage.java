package com.eventsync.infrastructure.scraper;

import org.apache.hc.core5.http.ContentType;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Response of a single GET. The body is already capped by the fetcher.
 */
public record FetchedPage(String url, int statusCode, String contentType, byte[] body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Charset from the Content-Type header, or null when the server did not declare one.
     */
    public Charset declaredCharset() {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        try {
            return ContentType.parse(contentType).getCharset();
        } catch (RuntimeException e) {
            return null;
        }
    }

    public String bodyAsString() {
        Charset charset = declaredCharset();
        return new String(body, charset != null ? charset : StandardCharsets.UTF_8);
    }
}
