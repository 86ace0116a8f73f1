package com.questrail.arena.ingest.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of IngestObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jIngestObservabilitySink implements IngestObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jIngestObservabilitySink.class);

    @Override
    public void onTailerReset(TailerResetEvent event) {
        if (event.previousOffset() < 0) {
            log.info("Log tailer reset ({}) for {}", event.reason(), event.path());
        } else {
            log.info("Log tailer reset ({}) for {}: discarded offset {}",
                event.reason(),
                event.path(),
                event.previousOffset());
        }
    }

    @Override
    public void onListenerFailure(ListenerFailureEvent event) {
        log.warn("Listener {} on channel '{}' failed", event.listener(), event.channel(), event.cause());
    }

    @Override
    public void onRemoteLookupFailure(RemoteLookupFailureEvent event) {
        log.warn("Remote lookup for grpId {} failed, using placeholder: {}",
            event.grpId(),
            event.cause() != null ? event.cause().toString() : "no detail");
    }

    @Override
    public void onError(IngestErrorEvent event) {
        log.error("{}: {}", event.component(), event.message(), event.cause());
    }
}
