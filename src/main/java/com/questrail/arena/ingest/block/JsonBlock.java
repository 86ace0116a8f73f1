package com.questrail.arena.ingest.block;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * JsonBlock
 * -----------------------------------------------------------------------------
 * One JSON object lifted out of the log, together with the tag of the line
 * that introduced it.
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link MethodBlock}: introduced by a method or event header; the tag
 *       is the method name (e.g. {@code EventSetDeckV2},
 *       {@code PlayerInventory.GetPlayerCardsV3}).</li>
 *   <li>{@link StandaloneBlock}: JSON with no method header, either after the
 *       logger prefix or on a bare line; the tag is always
 *       {@value #STANDALONE_TAG}.</li>
 * </ul>
 *
 * Payloads are always JSON objects. Consumers must treat them as read-only.
 */
public sealed interface JsonBlock
        permits JsonBlock.MethodBlock, JsonBlock.StandaloneBlock
{
    String STANDALONE_TAG = "standalone";

    String tag();

    ObjectNode payload();

    /**
     * Which header shape introduced a {@link MethodBlock}.
     */
    enum Direction {
        /** {@code ==> Method ...}: a call from the client. */
        REQUEST,
        /** {@code <== Method(id) ...}: a response to the client. */
        RESPONSE,
        /** {@code Match to X: EventType}: a match-service event. */
        EVENT
    }

    record MethodBlock(String tag, Direction direction, ObjectNode payload) implements JsonBlock {
        public MethodBlock {
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(direction, "direction");
            Objects.requireNonNull(payload, "payload");
        }
    }

    record StandaloneBlock(ObjectNode payload) implements JsonBlock {
        public StandaloneBlock {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public String tag() {
            return STANDALONE_TAG;
        }
    }
}
