package com.questrail.arena.ingest.observability;

/**
 * No-op implementation of IngestObservabilitySink.
 */
public final class NullIngestObservabilitySink implements IngestObservabilitySink {
    public static final NullIngestObservabilitySink INSTANCE = new NullIngestObservabilitySink();

    private NullIngestObservabilitySink() {}

    @Override
    public void onTailerReset(TailerResetEvent event) {}

    @Override
    public void onListenerFailure(ListenerFailureEvent event) {}

    @Override
    public void onRemoteLookupFailure(RemoteLookupFailureEvent event) {}

    @Override
    public void onError(IngestErrorEvent event) {}
}
