package com.questrail.arena.ingest.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.arena.ingest.block.BlockExtractor;
import com.questrail.arena.ingest.block.JsonBlock;
import com.questrail.arena.ingest.events.DeckCard;
import com.questrail.arena.ingest.events.DeckLists;
import com.questrail.arena.ingest.events.JsonFields;
import com.questrail.arena.ingest.events.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * LegacyLogParser
 * =============================================================================
 * Block-level match and collection extraction.
 *
 * <p>This path predates {@link com.questrail.arena.ingest.events.EventExtractor}
 * and still feeds the match-history and collection import. It looks at whole
 * blocks only: a match begins at the first block whose top-level
 * {@code matchId} differs from the current one and ends at a match-complete
 * block. Matches without a recognizable result are not reported.</p>
 *
 * <p>Seat numbers are fixed: seat 1 objects count as the player's, seat 2 as
 * the opponent's.</p>
 */
public final class LegacyLogParser {
    private static final Logger log = LoggerFactory.getLogger(LegacyLogParser.class);

    static final Set<String> DECK_SUBMIT_METHODS = Set.of("Event.DeckSubmitV3", "DeckSubmit", "DeckSubmitV3");
    static final Set<String> MATCH_COMPLETE_METHODS = Set.of("MatchComplete", "Event.MatchComplete");
    static final Set<String> COLLECTION_METHODS =
            Set.of("PlayerInventory.GetPlayerCardsV3", "PlayerInventory_GetPlayerCardsV3");

    private static final String GAME_STATE_MESSAGE_TYPE = "GREMessageType_GameStateMessage";

    private final BlockExtractor blockExtractor;

    public LegacyLogParser() {
        this(new BlockExtractor());
    }

    public LegacyLogParser(BlockExtractor blockExtractor) {
        this.blockExtractor = Objects.requireNonNull(blockExtractor, "blockExtractor");
    }

    /**
     * Extracts blocks from {@code text} and runs both passes over them.
     */
    public LegacyLogResult parse(String text) {
        List<JsonBlock> blocks = blockExtractor.extract(text);
        return new LegacyLogResult(extractMatches(blocks), extractCollection(blocks).orElse(null));
    }

    // -------------------------------------------------------------------------
    // Matches
    // -------------------------------------------------------------------------

    public List<LegacyMatchRecord> extractMatches(List<JsonBlock> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        List<LegacyMatchRecord> matches = new ArrayList<>();
        List<DeckCard> currentDeck = null;
        String currentMatchId = null;
        List<JsonNode> currentEvents = new ArrayList<>();
        String playerName = null;

        for (JsonBlock block : blocks) {
            String method = block.tag();
            ObjectNode data = block.payload();

            String name = JsonFields.text(data, "screenName");
            if (name == null) {
                name = JsonFields.text(data, "playerName");
            }
            if (name != null) {
                playerName = name;
            }

            if (DECK_SUBMIT_METHODS.contains(method)) {
                currentDeck = readSubmittedDeck(data);
            }

            String matchId = JsonFields.text(data, "matchId");
            if (matchId != null && !matchId.equals(currentMatchId)) {
                if (currentMatchId != null && !currentEvents.isEmpty()) {
                    addIfComplete(matches, buildMatch(currentMatchId, currentEvents, currentDeck, playerName, null));
                }
                currentMatchId = matchId;
                currentEvents = new ArrayList<>();
            }

            JsonNode gre = data.get("greToClientEvent");
            if (gre != null) {
                JsonFields.elements(gre, "greToClientMessages").forEach(currentEvents::add);
            } else if (data.has("gameStateMessage")) {
                currentEvents.add(data);
            }

            if (MATCH_COMPLETE_METHODS.contains(method) || data.has("matchComplete")) {
                JsonNode resultData = data.has("matchComplete") ? data.get("matchComplete") : data;
                if (currentMatchId != null) {
                    addIfComplete(matches, buildMatch(currentMatchId, currentEvents, currentDeck, playerName, resultData));
                    currentMatchId = null;
                    currentEvents = new ArrayList<>();
                }
            }
        }

        if (currentMatchId != null && !currentEvents.isEmpty()) {
            addIfComplete(matches, buildMatch(currentMatchId, currentEvents, currentDeck, playerName, null));
        }
        return matches;
    }

    private static void addIfComplete(List<LegacyMatchRecord> out, LegacyMatchRecord match) {
        if (match != null) {
            out.add(match);
        }
    }

    private static LegacyMatchRecord buildMatch(String matchId,
                                                List<JsonNode> events,
                                                List<DeckCard> deck,
                                                String playerName,
                                                JsonNode resultData) {
        MatchResult result = resultData != null ? parseResult(resultData) : null;
        if (result == null) {
            log.debug("Match {} ended without a recognizable result; not recorded", matchId);
            return null;
        }

        int turns = 0;
        Set<Integer> cardsPlayed = new LinkedHashSet<>();
        Set<Integer> opponentCards = new LinkedHashSet<>();

        for (JsonNode event : events) {
            JsonNode gsm = event.get("gameStateMessage");
            if (gsm == null) {
                continue;
            }
            int turn = JsonFields.intValue(gsm.get("turnInfo"), "turnNumber", 0);
            turns = Math.max(turns, turn);

            if (!GAME_STATE_MESSAGE_TYPE.equals(JsonFields.text(event, "type"))) {
                continue;
            }
            for (JsonNode object : JsonFields.elements(gsm, "gameObjects")) {
                int grpId = JsonFields.intValue(object, "grpId", 0);
                if (grpId == 0) {
                    continue;
                }
                int owner = JsonFields.intValue(object, "ownerSeatId", 0);
                if (owner == 1) {
                    cardsPlayed.add(grpId);
                } else if (owner == 2) {
                    opponentCards.add(grpId);
                }
            }
        }

        return new LegacyMatchRecord(matchId, playerName, null, result, null, turns, deck,
                new ArrayList<>(cardsPlayed), new ArrayList<>(opponentCards));
    }

    static MatchResult parseResult(JsonNode resultData) {
        JsonNode value = JsonFields.first(resultData, "result", "matchResult");
        if (value == null || !value.isTextual()) {
            return null;
        }
        String text = value.asText();
        if (text.contains("Win")) {
            return MatchResult.WIN;
        }
        if (text.contains("Loss")) {
            return MatchResult.LOSS;
        }
        if (text.contains("Draw")) {
            return MatchResult.DRAW;
        }
        return null;
    }

    private static List<DeckCard> readSubmittedDeck(ObjectNode data) {
        JsonNode deckData = data.has("CourseDeck") ? data.get("CourseDeck") : data;
        return DeckLists.parseEntries(JsonFields.first(deckData, "mainDeck", "MainDeck"));
    }

    // -------------------------------------------------------------------------
    // Collection
    // -------------------------------------------------------------------------

    /**
     * The card collection from the last inventory response carrying at least
     * one numeric {@code "grpId": quantity} entry.
     */
    public Optional<Map<Integer, Integer>> extractCollection(List<JsonBlock> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        Map<Integer, Integer> last = null;
        for (JsonBlock block : blocks) {
            if (!COLLECTION_METHODS.contains(block.tag())) {
                continue;
            }
            Map<Integer, Integer> collection = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = block.payload().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                JsonNode value = field.getValue();
                if (!key.isEmpty() && key.chars().allMatch(Character::isDigit) && value.isNumber()) {
                    try {
                        collection.put(Integer.parseInt(key), value.asInt());
                    } catch (NumberFormatException e) {
                        log.debug("Skipping out-of-range collection key {}", key);
                    }
                }
            }
            if (!collection.isEmpty()) {
                last = collection;
            }
        }
        return Optional.ofNullable(last);
    }
}
