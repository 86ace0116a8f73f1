/**
 * Block Extraction
 * =============================================================================
 *
 * <p>Turns raw log text into tagged JSON objects. This layer knows the shapes
 * the client writes its lines in, and nothing about what the objects mean.</p>
 *
 * <h2>Placement</h2>
 * <pre>
 *   LogTailer chunk
 *        → StreamingBlockBuffer   (accumulate, hand out each block once)
 *            → BlockExtractor     (line shapes, multi-line balancing)
 *                → JsonBlock      (method tag or "standalone", ObjectNode payload)
 *                    → EventExtractor / LegacyLogParser
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>Extraction is pure; a {@link com.questrail.arena.ingest.block.BlockExtractor}
 *       holds configuration only.</li>
 *   <li>Any text that does not parse as a JSON object is dropped here and never
 *       reaches the decoders.</li>
 * </ul>
 */
package com.questrail.arena.ingest.block;
