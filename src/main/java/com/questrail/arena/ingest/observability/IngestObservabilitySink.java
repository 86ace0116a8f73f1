package com.questrail.arena.ingest.observability;

/**
 * Receives pipeline-level observability events from the ingestion components.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>None of these callbacks may throw back into the pipeline; the ingestion
 * loop keeps running regardless of what a sink does.</p>
 */
public interface IngestObservabilitySink {
    /**
     * Called when the tailer discards its position (rotation, truncation or restart).
     * @param event the reset details
     */
    void onTailerReset(TailerResetEvent event);

    /**
     * Called when a state-change or event listener throws.
     * @param event the failing listener and its exception
     */
    void onListenerFailure(ListenerFailureEvent event);

    /**
     * Called when a remote card lookup fails and the resolver degrades to a placeholder.
     * @param event the lookup failure
     */
    void onRemoteLookupFailure(RemoteLookupFailureEvent event);

    /**
     * Called for a reported, non-fatal error such as an I/O failure during a poll.
     * @param event the error event
     */
    void onError(IngestErrorEvent event);
}
