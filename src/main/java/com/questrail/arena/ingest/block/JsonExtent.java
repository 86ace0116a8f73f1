package com.questrail.arena.ingest.block;

/**
 * Tracks bracket depth across the lines of a JSON fragment, skipping brackets
 * inside string literals, and reports where the outermost value closes.
 */
final class JsonExtent {

    private int depth;
    private boolean inString;
    private boolean escaped;
    private boolean started;

    /**
     * Feeds one line.
     *
     * @return index just past the character that closed the outermost value,
     *         or -1 if the value is still open at the end of the line
     */
    int feed(CharSequence line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            switch (c) {
                case '"':
                    inString = true;
                    break;
                case '{':
                case '[':
                    depth++;
                    started = true;
                    break;
                case '}':
                case ']':
                    depth--;
                    if (started && depth <= 0) {
                        return i + 1;
                    }
                    break;
                default:
                    break;
            }
        }
        return -1;
    }
}
