package com.eventsync.infrastructure.normalization;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Text helpers used while building canonical events.
 */
public final class NormalizationUtils {

    private static final int SCRAPED_ID_HEX_LENGTH = 16;

    private NormalizationUtils() {
    }

    /**
     * Trims and collapses runs of whitespace (including newlines from HTML) to one space.
     */
    public static String collapseWhitespace(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Stable identifier for a listing that has no URL of its own, so that repeated
     * scrapes of the same listing produce the same id.
     *
     * The name is hashed as scraped with whitespace collapsed. Case, punctuation
     * and non-Latin letters are kept.
     *
     * Format: scraped:&lt;source&gt;:&lt;16 hex chars of sha256(name|startDate|source)&gt;
     * Example: scraped:city-hall:fe93f80c25120c8c
     */
    public static String generateScrapedEventId(String sourceName, String name, String startDate) {
        String key = collapseWhitespace(name) + "|" + (startDate == null ? "" : startDate.trim()) + "|" + sourceName;
        return "scraped:" + sourceName + ":" + sha256Hex(key).substring(0, SCRAPED_ID_HEX_LENGTH);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
