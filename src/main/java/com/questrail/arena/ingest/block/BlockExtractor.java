package com.questrail.arena.ingest.block;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.arena.ingest.config.BlockExtractionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BlockExtractor
 * =============================================================================
 * Lifts tagged JSON objects out of raw log text.
 *
 * <h2>Recognized line shapes</h2>
 * <ul>
 *   <li>{@code ==> Method(id): {json}} and {@code <== Method(id): {json}}</li>
 *   <li>{@code [UnityCrossThreadLogger]==> Method {json}}; a string
 *       {@code request} field holding escaped JSON is parsed and attached as
 *       {@value #PARSED_REQUEST_FIELD}</li>
 *   <li>{@code <== Method(id)} with the JSON on the following line</li>
 *   <li>{@code [UnityCrossThreadLogger]<time>: Match to X: EventType} with the
 *       JSON on the following line</li>
 *   <li>{@code [UnityCrossThreadLogger]{json}} (standalone)</li>
 *   <li>bare lines starting with {@code {}, kept only when the object carries
 *       one of {@link #RECOGNIZED_BARE_KEYS}</li>
 * </ul>
 *
 * <h2>Multi-line JSON</h2>
 * A value left open at the end of its first line is continued onto following
 * lines until its brackets balance, up to
 * {@link BlockExtractionPolicy#maxJsonLines()} continuation lines. Brackets
 * inside string literals do not count.
 *
 * <h2>Failure handling</h2>
 * Malformed JSON, unbalanced fragments and non-object values are dropped; the
 * rest of the text is still extracted. {@link #extract(String)} never throws
 * for bad input.
 *
 * <p>Instances are stateless apart from configuration and safe to share.</p>
 */
public final class BlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(BlockExtractor.class);

    public static final String PARSED_REQUEST_FIELD = "_parsed_request";

    /** Top-level keys that make a bare JSON line worth keeping. */
    public static final Set<String> RECOGNIZED_BARE_KEYS = Set.of(
            "greToClientEvent",
            "matchGameRoomStateChangedEvent",
            "authenticateResponse",
            "clientToMatchServiceMessageType",
            "connectResp");

    private static final String LOGGER_PREFIX = "[UnityCrossThreadLogger]";

    private static final Pattern CALL_LINE =
            Pattern.compile("(==>|<==)\\s+(\\w+(?:\\.\\w+)*)\\s*\\([^)]*\\)\\s*:\\s*(\\{.*)");
    private static final Pattern LOGGER_CALL_LINE =
            Pattern.compile("\\[UnityCrossThreadLogger\\]\\s*==>\\s*(\\w+(?:\\.\\w+)*)\\s+(\\{.*)");
    private static final Pattern RESPONSE_HEADER =
            Pattern.compile("<==\\s+(\\w+(?:\\.\\w+)*)\\s*\\([^)]*\\)\\s*$");
    private static final Pattern MATCH_EVENT_HEADER =
            Pattern.compile("\\[UnityCrossThreadLogger\\].*Match to \\S+:\\s+(\\w+)\\s*$");
    private static final Pattern LOGGER_JSON =
            Pattern.compile("\\[UnityCrossThreadLogger\\]\\s*(\\{.*)");

    private static final int MIN_BARE_LINE_LENGTH = 11;

    private final ObjectMapper mapper;
    private final BlockExtractionPolicy policy;

    public BlockExtractor() {
        this(new ObjectMapper(), BlockExtractionPolicy.defaults());
    }

    public BlockExtractor(ObjectMapper mapper, BlockExtractionPolicy policy) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Extracts every recognizable block from {@code text}, in order of appearance.
     */
    public List<JsonBlock> extract(String text) {
        Objects.requireNonNull(text, "text");
        List<JsonBlock> blocks = new ArrayList<>();
        if (text.isEmpty()) {
            return blocks;
        }

        String[] lines = splitLines(text);
        int i = 0;
        while (i < lines.length) {
            i = extractAt(lines, i, blocks);
        }
        return blocks;
    }

    // -------------------------------------------------------------------------
    // Line dispatch
    // -------------------------------------------------------------------------

    /**
     * Tries each line shape at {@code lines[i]}.
     *
     * @return index of the next line to examine
     */
    private int extractAt(String[] lines, int i, List<JsonBlock> out) {
        String line = lines[i];

        Matcher m = CALL_LINE.matcher(line);
        if (m.find()) {
            JsonBlock.Direction direction = "==>".equals(m.group(1))
                    ? JsonBlock.Direction.REQUEST
                    : JsonBlock.Direction.RESPONSE;
            return emitMethod(m.group(2), direction, m.group(3), lines, i + 1, out);
        }

        m = LOGGER_CALL_LINE.matcher(line);
        if (m.find()) {
            return emitMethod(m.group(1), JsonBlock.Direction.REQUEST, m.group(2), lines, i + 1, out);
        }

        m = MATCH_EVENT_HEADER.matcher(line);
        if (m.find()) {
            return emitFromNextLine(m.group(1), JsonBlock.Direction.EVENT, lines, i, out);
        }

        m = RESPONSE_HEADER.matcher(line);
        if (m.find()) {
            return emitFromNextLine(m.group(1), JsonBlock.Direction.RESPONSE, lines, i, out);
        }

        m = LOGGER_JSON.matcher(line);
        if (m.find()) {
            Collected collected = collect(m.group(1), lines, i + 1);
            ObjectNode payload = tryParse(collected);
            if (payload == null) {
                return i + 1;
            }
            out.add(new JsonBlock.StandaloneBlock(payload));
            return collected.nextLine;
        }

        String stripped = line.strip();
        if (stripped.startsWith("{") && stripped.length() >= MIN_BARE_LINE_LENGTH
                && !stripped.startsWith(LOGGER_PREFIX)) {
            Collected collected = collect(stripped, lines, i + 1);
            ObjectNode payload = tryParse(collected);
            if (payload != null && hasRecognizedKey(payload)) {
                out.add(new JsonBlock.StandaloneBlock(payload));
                return collected.nextLine;
            }
        }

        return i + 1;
    }

    private int emitMethod(String method,
                           JsonBlock.Direction direction,
                           String firstFragment,
                           String[] lines,
                           int nextIdx,
                           List<JsonBlock> out) {
        Collected collected = collect(firstFragment, lines, nextIdx);
        ObjectNode payload = tryParse(collected);
        if (payload == null) {
            return nextIdx;
        }
        attachParsedRequest(method, payload);
        out.add(new JsonBlock.MethodBlock(method, direction, payload));
        return collected.nextLine;
    }

    private int emitFromNextLine(String tag,
                                 JsonBlock.Direction direction,
                                 String[] lines,
                                 int headerIdx,
                                 List<JsonBlock> out) {
        int jsonIdx = headerIdx + 1;
        if (jsonIdx >= lines.length) {
            return jsonIdx;
        }
        String next = lines[jsonIdx].strip();
        if (!next.startsWith("{")) {
            return jsonIdx;
        }
        Collected collected = collect(next, lines, jsonIdx + 1);
        ObjectNode payload = tryParse(collected);
        if (payload == null) {
            return jsonIdx;
        }
        out.add(new JsonBlock.MethodBlock(tag, direction, payload));
        return collected.nextLine;
    }

    // -------------------------------------------------------------------------
    // Collection and parsing
    // -------------------------------------------------------------------------

    private record Collected(String json, int nextLine, boolean balanced) {}

    private Collected collect(String first, String[] lines, int nextIdx) {
        JsonExtent extent = new JsonExtent();
        int end = extent.feed(first);
        if (end >= 0) {
            return new Collected(first.substring(0, end), nextIdx, true);
        }

        StringBuilder json = new StringBuilder(first);
        int idx = nextIdx;
        int consumed = 0;
        while (idx < lines.length && consumed < policy.maxJsonLines()) {
            String line = lines[idx];
            idx++;
            consumed++;
            end = extent.feed(line);
            json.append('\n');
            if (end >= 0) {
                json.append(line, 0, end);
                return new Collected(json.toString(), idx, true);
            }
            json.append(line);
        }
        return new Collected(json.toString(), idx, false);
    }

    private ObjectNode tryParse(Collected collected) {
        if (!collected.balanced()) {
            log.debug("Dropping unbalanced JSON fragment of {} chars", collected.json().length());
            return null;
        }
        try {
            return parseObject(collected.json());
        } catch (BlockDecodeException e) {
            log.debug("Dropping malformed block: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Parses {@code json} as a JSON object.
     *
     * @throws BlockDecodeException if the text is not valid JSON or not an object
     */
    ObjectNode parseObject(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new BlockDecodeException("Invalid JSON: " + abbreviate(json), e);
        }
        if (node == null || !node.isObject()) {
            throw new BlockDecodeException("Not a JSON object: " + abbreviate(json));
        }
        return (ObjectNode) node;
    }

    private void attachParsedRequest(String method, ObjectNode payload) {
        JsonNode request = payload.get("request");
        if (request == null || !request.isTextual()) {
            return;
        }
        try {
            payload.set(PARSED_REQUEST_FIELD, parseObject(request.asText()));
        } catch (BlockDecodeException e) {
            log.debug("{}: request field is not embedded JSON: {}", method, e.getMessage());
        }
    }

    private static boolean hasRecognizedKey(ObjectNode payload) {
        Iterator<String> names = payload.fieldNames();
        while (names.hasNext()) {
            if (RECOGNIZED_BARE_KEYS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    private static String[] splitLines(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (!line.isEmpty() && line.charAt(line.length() - 1) == '\r') {
                lines[i] = line.substring(0, line.length() - 1);
            }
        }
        return lines;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 80) + "...";
    }
}
