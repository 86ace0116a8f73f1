package com.questrail.arena.ingest.telemetry;

import java.util.List;

/**
 * Actions recorded since the previous flush, plus the match summary on the
 * final flush. A batch is immutable and can be queued and delivered again.
 *
 * @param summary null except on the final flush
 */
public record TelemetryBatch(List<TelemetryAction> actions, MatchTelemetrySummary summary) {
    public TelemetryBatch {
        actions = List.copyOf(actions);
    }

    public boolean hasSummary() {
        return summary != null;
    }

    public boolean isEmpty() {
        return actions.isEmpty() && summary == null;
    }
}
