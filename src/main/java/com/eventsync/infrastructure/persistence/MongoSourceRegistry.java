package com.eventsync.infrastructure.persistence;

import com.eventsync.domain.model.SelectorConfig;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.ports.SourceRegistry;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * MongoDB backed source registry. One document per source in {@code scraper_sources},
 * keyed by a unique {@code name}.
 */
@Repository
@ConditionalOnProperty(name = "scraper.mongo.enabled", havingValue = "true")
public class MongoSourceRegistry implements SourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(MongoSourceRegistry.class);
    static final String COLLECTION = "scraper_sources";

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoSourceRegistry(
            MongoClient mongoClient,
            @Value("${mongodb.database:eventsync}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection().createIndex(
                Indexes.ascending("name"),
                new IndexOptions().unique(true).background(true)
            );
            collection().createIndex(
                Indexes.ascending("enabled"),
                new IndexOptions().background(true)
            );
            logger.info("MongoDB indexes initialized for collection: {}", COLLECTION);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(COLLECTION);
    }

    @Override
    public List<SourceConfig> listEnabled() {
        return find(Filters.eq("enabled", true));
    }

    @Override
    public List<SourceConfig> listAll() {
        return find(new Document());
    }

    private List<SourceConfig> find(Bson filter) {
        List<SourceConfig> sources = new ArrayList<>();
        for (Document doc : collection().find(filter).sort(Indexes.ascending("name"))) {
            try {
                sources.add(documentToSource(doc));
            } catch (RuntimeException e) {
                logger.warn("Skipping malformed source document {}: {}", doc.get("_id"), e.getMessage());
            }
        }
        return sources;
    }

    @Override
    public boolean upsert(SourceConfig source) {
        Date now = new Date();
        List<Bson> updates = new ArrayList<>();
        sourceToDocument(source).forEach((key, value) -> updates.add(Updates.set(key, value)));
        updates.add(Updates.set("updated_at", now));
        updates.add(Updates.setOnInsert("created_at", now));

        UpdateResult result = collection().updateOne(
            Filters.eq("name", source.getName()),
            Updates.combine(updates),
            new UpdateOptions().upsert(true)
        );
        boolean created = result.getUpsertedId() != null;
        logger.debug("{} source {}", created ? "Created" : "Updated", source.getName());
        return created;
    }

    @Override
    public void markScraped(String sourceName) {
        collection().updateOne(
            Filters.eq("name", sourceName),
            Updates.set("last_scraped_at", new Date())
        );
    }

    static Document sourceToDocument(SourceConfig source) {
        Document doc = new Document("name", source.getName())
            .append("url", source.getUrl())
            .append("tier", source.getTier())
            .append("schedule", source.getSchedule())
            .append("trust_level", source.getTrustLevel())
            .append("license", source.getLicense())
            .append("enabled", source.isEnabled())
            .append("event_url_pattern", source.getEventUrlPattern())
            .append("max_pages", source.getMaxPages())
            .append("notes", source.getNotes());

        SelectorConfig selectors = source.getSelectors();
        if (selectors != null) {
            doc.append("selectors", new Document("event_list", selectors.eventList())
                .append("name", selectors.name())
                .append("start_date", selectors.startDate())
                .append("end_date", selectors.endDate())
                .append("location", selectors.location())
                .append("description", selectors.description())
                .append("url", selectors.url())
                .append("image", selectors.image())
                .append("pagination", selectors.pagination()));
        }
        return doc;
    }

    static SourceConfig documentToSource(Document doc) {
        SourceConfig.Builder builder = SourceConfig.builder()
            .name(doc.getString("name"))
            .url(doc.getString("url"))
            .license(doc.getString("license"))
            .eventUrlPattern(doc.getString("event_url_pattern"))
            .notes(doc.getString("notes"));

        Integer tier = doc.getInteger("tier");
        if (tier != null) {
            builder.tier(tier);
        }
        String schedule = doc.getString("schedule");
        if (schedule != null) {
            builder.schedule(schedule);
        }
        Integer trustLevel = doc.getInteger("trust_level");
        if (trustLevel != null) {
            builder.trustLevel(trustLevel);
        }
        Boolean enabled = doc.getBoolean("enabled");
        if (enabled != null) {
            builder.enabled(enabled);
        }
        Integer maxPages = doc.getInteger("max_pages");
        if (maxPages != null) {
            builder.maxPages(maxPages);
        }

        Document selectors = doc.get("selectors", Document.class);
        if (selectors != null) {
            builder.selectors(new SelectorConfig(
                selectors.getString("event_list"),
                selectors.getString("name"),
                selectors.getString("start_date"),
                selectors.getString("end_date"),
                selectors.getString("location"),
                selectors.getString("description"),
                selectors.getString("url"),
                selectors.getString("image"),
                selectors.getString("pagination")
            ));
        }
        return builder.build();
    }
}
