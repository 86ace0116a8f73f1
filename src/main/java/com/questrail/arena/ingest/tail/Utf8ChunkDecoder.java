package com.questrail.arena.ingest.tail;

import java.nio.charset.StandardCharsets;

/**
 * Decodes successive byte ranges as UTF-8 without splitting a multi-byte
 * sequence across two chunks: trailing bytes of an incomplete sequence are
 * held back and prefixed to the next range.
 */
final class Utf8ChunkDecoder {

    private byte[] pending = new byte[0];

    String decode(byte[] bytes) {
        byte[] data = bytes;
        if (pending.length > 0) {
            data = new byte[pending.length + bytes.length];
            System.arraycopy(pending, 0, data, 0, pending.length);
            System.arraycopy(bytes, 0, data, pending.length, bytes.length);
        }

        int complete = completeLength(data);
        pending = new byte[data.length - complete];
        System.arraycopy(data, complete, pending, 0, pending.length);
        return new String(data, 0, complete, StandardCharsets.UTF_8);
    }

    void reset() {
        pending = new byte[0];
    }

    int pendingBytes() {
        return pending.length;
    }

    // Length of the longest prefix that ends on a code point boundary.
    static int completeLength(byte[] data) {
        int len = data.length;
        int i = len - 1;
        while (i >= 0 && len - i < 4 && (data[i] & 0xC0) == 0x80) {
            i--;
        }
        if (i < 0) {
            return len;
        }

        int lead = data[i] & 0xFF;
        int needed;
        if (lead >= 0xF0) {
            needed = 4;
        } else if (lead >= 0xE0) {
            needed = 3;
        } else if (lead >= 0xC0) {
            needed = 2;
        } else {
            needed = 1;
        }
        return (len - i < needed) ? i : len;
    }
}
