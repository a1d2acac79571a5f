package com.eventsync.infrastructure.persistence;

import com.eventsync.domain.model.ScrapeResult;
import com.eventsync.domain.model.ScrapeRun;
import com.eventsync.domain.ports.ScrapeRunTracker;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records one document per source run in {@code scraper_runs}.
 * Old runs expire after {@value #TTL_DAYS} days.
 */
@Repository
@ConditionalOnProperty(name = "scraper.mongo.enabled", havingValue = "true")
public class MongoScrapeRunTracker implements ScrapeRunTracker {

    private static final Logger logger = LoggerFactory.getLogger(MongoScrapeRunTracker.class);
    static final String COLLECTION = "scraper_runs";
    private static final int TTL_DAYS = 90;

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoScrapeRunTracker(
            MongoClient mongoClient,
            @Value("${mongodb.database:eventsync}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection().createIndex(
                Indexes.compoundIndex(
                    Indexes.ascending("source_name"),
                    Indexes.descending("started_at")
                ),
                new IndexOptions().background(true)
            );
            collection().createIndex(
                Indexes.ascending("started_at"),
                new IndexOptions()
                    .expireAfter((long) TTL_DAYS, TimeUnit.DAYS)
                    .background(true)
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
    public String runStarted(String sourceName, String sourceUrl, int tier) {
        ObjectId id = new ObjectId();
        collection().insertOne(new Document("_id", id)
            .append("source_name", sourceName)
            .append("source_url", sourceUrl)
            .append("tier", tier)
            .append("status", ScrapeRun.Status.RUNNING.name())
            .append("started_at", new Date()));
        return id.toHexString();
    }

    @Override
    public void runCompleted(String runId, ScrapeResult result) {
        if (runId == null) {
            return;
        }
        collection().updateOne(
            Filters.eq("_id", new ObjectId(runId)),
            Updates.combine(
                Updates.set("status", ScrapeRun.Status.COMPLETED.name()),
                Updates.set("completed_at", new Date()),
                Updates.set("events_found", result.getEventsFound()),
                Updates.set("events_created", result.getEventsCreated()),
                Updates.set("events_duplicate", result.getEventsDuplicate()),
                Updates.set("events_failed", result.getEventsFailed())
            )
        );
    }

    @Override
    public void runFailed(String runId, Exception error) {
        if (runId == null) {
            return;
        }
        collection().updateOne(
            Filters.eq("_id", new ObjectId(runId)),
            Updates.combine(
                Updates.set("status", ScrapeRun.Status.FAILED.name()),
                Updates.set("completed_at", new Date()),
                Updates.set("error_message", error != null ? error.getMessage() : null)
            )
        );
    }

    @Override
    public List<ScrapeRun> recentRuns(int limit) {
        List<ScrapeRun> runs = new ArrayList<>();
        for (Document doc : collection().find().sort(Sorts.descending("started_at")).limit(limit)) {
            runs.add(documentToRun(doc));
        }
        return runs;
    }

    static ScrapeRun documentToRun(Document doc) {
        ScrapeRun run = new ScrapeRun();
        ObjectId id = doc.getObjectId("_id");
        run.setRunId(id != null ? id.toHexString() : null);
        run.setSourceName(doc.getString("source_name"));
        run.setSourceUrl(doc.getString("source_url"));
        run.setTier(doc.getInteger("tier", 0));
        String status = doc.getString("status");
        run.setStatus(status != null ? ScrapeRun.Status.valueOf(status) : null);
        Date startedAt = doc.getDate("started_at");
        run.setStartedAt(startedAt != null ? startedAt.toInstant() : null);
        Date completedAt = doc.getDate("completed_at");
        run.setCompletedAt(completedAt != null ? completedAt.toInstant() : null);
        run.setEventsFound(doc.getInteger("events_found", 0));
        run.setEventsCreated(doc.getInteger("events_created", 0));
        run.setEventsDuplicate(doc.getInteger("events_duplicate", 0));
        run.setEventsFailed(doc.getInteger("events_failed", 0));
        run.setErrorMessage(doc.getString("error_message"));
        return run;
    }
}
