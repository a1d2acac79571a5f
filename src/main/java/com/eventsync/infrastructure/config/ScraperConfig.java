package com.eventsync.infrastructure.config;

import com.eventsync.infrastructure.ingest.HttpIngestClient;
import com.eventsync.infrastructure.normalization.EventNormalizer;
import com.eventsync.infrastructure.scraper.HttpFetcher;
import com.eventsync.infrastructure.scraper.RobotsPolicy;
import com.eventsync.infrastructure.scraper.inspect.PageInspector;
import com.eventsync.infrastructure.scraper.jsonld.JsonLdExtractor;
import com.eventsync.infrastructure.scraper.selector.SelectorCrawler;
import com.eventsync.infrastructure.source.YamlSourceConfigLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Scraping, normalization and ingest wiring.
 */
@Configuration
public class ScraperConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    @Value("${scraper.user-agent:EventSync-Scraper/0.1 (+https://eventsync.example; scraper@eventsync.example)}")
    private String userAgent;

    @Value("${scraper.crawl.delay-ms:1000}")
    private long crawlDelayMs;

    @Value("${scraper.crawl.timeout-ms:30000}")
    private long crawlTimeoutMs;

    @Value("${scraper.crawl.threads:4}")
    private int crawlThreads;

    @Value("${scraper.ingest.base-url:http://localhost:8080}")
    private String ingestBaseUrl;

    @Value("${scraper.ingest.api-key:}")
    private String ingestApiKey;

    @Value("${scraper.ingest.timeout-ms:30000}")
    private long ingestTimeoutMs;

    @Bean
    public HttpFetcher httpFetcher() {
        return new HttpFetcher(userAgent);
    }

    @Bean
    public RobotsPolicy robotsPolicy(HttpFetcher httpFetcher) {
        return new RobotsPolicy(httpFetcher);
    }

    @Bean
    public JsonLdExtractor jsonLdExtractor(HttpFetcher httpFetcher, RobotsPolicy robotsPolicy,
                                           ObjectMapper objectMapper) {
        return new JsonLdExtractor(httpFetcher, robotsPolicy, objectMapper);
    }

    @Bean
    public SelectorCrawler selectorCrawler(HttpFetcher httpFetcher, RobotsPolicy robotsPolicy) {
        return new SelectorCrawler(httpFetcher, robotsPolicy, Duration.ofMillis(crawlDelayMs),
            Duration.ofMillis(crawlTimeoutMs), crawlThreads);
    }

    @Bean
    public EventNormalizer eventNormalizer() {
        return new EventNormalizer();
    }

    @Bean
    public HttpIngestClient httpIngestClient(ObjectMapper objectMapper) {
        if (ingestApiKey == null || ingestApiKey.isBlank()) {
            logger.warn("scraper.ingest.api-key is not set; only dry runs will succeed");
        }
        return new HttpIngestClient(ingestBaseUrl, ingestApiKey, userAgent, Duration.ofMillis(ingestTimeoutMs),
            objectMapper);
    }

    @Bean
    public YamlSourceConfigLoader yamlSourceConfigLoader() {
        return new YamlSourceConfigLoader();
    }

    @Bean
    public PageInspector pageInspector(HttpFetcher httpFetcher) {
        return new PageInspector(httpFetcher);
    }
}
