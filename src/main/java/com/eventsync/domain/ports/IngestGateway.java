package com.eventsync.domain.ports;

import com.eventsync.domain.exception.IngestException;
import com.eventsync.domain.model.CancellationToken;
import com.eventsync.domain.model.EventInput;
import com.eventsync.domain.model.IngestResult;

import java.util.List;

/**
 * Port for delivering normalized events to the central events API.
 */
public interface IngestGateway {

    /**
     * Submits the events as one logical batch. No retries are performed.
     * Once the token is cancelled no further request is started and an
     * in-flight request is aborted.
     *
     * @throws IngestException on transport failure, cancellation or a non-2xx response
     *                         ({@link com.eventsync.domain.exception.RateLimitedException} for 429)
     */
    IngestResult submitBatch(List<EventInput> events, CancellationToken token) throws IngestException;

    /**
     * Reports every event as created without any network call.
     */
    IngestResult submitBatchDryRun(List<EventInput> events);

    default IngestResult submit(List<EventInput> events, boolean dryRun, CancellationToken token)
            throws IngestException {
        return dryRun ? submitBatchDryRun(events) : submitBatch(events, token);
    }
}
