package com.questrail.arena.ingest.events;

/**
 * Decode counters accumulated over an extraction context's lifetime.
 *
 * <p>A hit or miss is counted each time a zone transfer or damage annotation
 * needs a grpId; misses are the events dropped for lack of identity.</p>
 */
public final class ExtractionStats {

    private long gameStateMessages;
    private long zoneTransfers;
    private long grpIdHits;
    private long grpIdMisses;
    private long objectIdChanges;
    private long shuffleRemaps;
    private long diffDeleted;

    /**
     * Immutable copy of the counters.
     */
    public record Snapshot(
            long gameStateMessages,
            long zoneTransfers,
            long grpIdHits,
            long grpIdMisses,
            long objectIdChanges,
            long shuffleRemaps,
            long diffDeleted
    ) {
    }

    public Snapshot snapshot() {
        return new Snapshot(gameStateMessages, zoneTransfers, grpIdHits, grpIdMisses,
                objectIdChanges, shuffleRemaps, diffDeleted);
    }

    void reset() {
        gameStateMessages = 0;
        zoneTransfers = 0;
        grpIdHits = 0;
        grpIdMisses = 0;
        objectIdChanges = 0;
        shuffleRemaps = 0;
        diffDeleted = 0;
    }

    void gameStateMessage() {
        gameStateMessages++;
    }

    void zoneTransfer() {
        zoneTransfers++;
    }

    void grpIdHit() {
        grpIdHits++;
    }

    void grpIdMiss() {
        grpIdMisses++;
    }

    void objectIdChange() {
        objectIdChanges++;
    }

    void shuffleRemaps(int count) {
        shuffleRemaps += count;
    }

    void diffDeleted(int count) {
        diffDeleted += count;
    }

    @Override
    public String toString() {
        return "gsm:" + gameStateMessages
                + " zt:" + zoneTransfers + "(hit:" + grpIdHits + "/miss:" + grpIdMisses + ")"
                + " oid:" + objectIdChanges
                + " shuf:" + shuffleRemaps
                + " del:" + diffDeleted;
    }
}
