package com.questrail.arena.ingest.block;

import com.questrail.arena.ingest.config.StreamingBufferPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * StreamingBlockBuffer
 * -----------------------------------------------------------------------------
 * Accumulates tailed text and hands out each extracted block exactly once.
 *
 * <p>Chunks rarely end on a block boundary, so the whole buffer is re-extracted
 * after every append and only blocks past the processed counter are returned.
 * A block still incomplete at the end of the buffer fails to parse, is not
 * counted, and is returned by the append that completes it.</p>
 *
 * <h2>Trimming</h2>
 * Once the buffer exceeds {@link StreamingBufferPolicy#trimThreshold()} only the
 * last {@link StreamingBufferPolicy#retainedChars()} characters are kept and the
 * processed counter is recomputed against the trimmed text, so blocks that
 * survive the trim are not returned a second time.
 *
 * <p>Not thread-safe; owned by the single thread running the poll cycle.</p>
 */
public final class StreamingBlockBuffer {
    private static final Logger log = LoggerFactory.getLogger(StreamingBlockBuffer.class);

    private final BlockExtractor extractor;
    private final StreamingBufferPolicy policy;
    private final StringBuilder buffer = new StringBuilder();
    private int processedCount;

    public StreamingBlockBuffer(BlockExtractor extractor, StreamingBufferPolicy policy) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Appends {@code chunk} and returns the blocks not returned before.
     */
    public List<JsonBlock> append(String chunk) {
        Objects.requireNonNull(chunk, "chunk");
        buffer.append(chunk);

        List<JsonBlock> all = extractor.extract(buffer.toString());
        List<JsonBlock> fresh = processedCount < all.size()
                ? List.copyOf(all.subList(processedCount, all.size()))
                : List.of();
        processedCount = all.size();

        if (buffer.length() > policy.trimThreshold()) {
            trim();
        }
        return fresh;
    }

    /** Drops all buffered text and the processed counter. */
    public void clear() {
        buffer.setLength(0);
        processedCount = 0;
    }

    public int processedCount() {
        return processedCount;
    }

    public int bufferLength() {
        return buffer.length();
    }

    private void trim() {
        int before = buffer.length();
        buffer.delete(0, before - policy.retainedChars());
        processedCount = extractor.extract(buffer.toString()).size();
        log.debug("Trimmed streaming buffer from {} to {} chars; {} blocks retained",
                before, buffer.length(), processedCount);
    }
}
