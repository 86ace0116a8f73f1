package com.questrail.arena.ingest.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsing of the deck-list shapes the client writes.
 *
 * <p>Entries are either objects ({@code cardId}/{@code Id} plus
 * {@code quantity}/{@code Quantity}, default 1) or bare grpIds meaning one
 * copy. Repeated grpIds are merged into one line, keeping first-seen order.</p>
 */
public final class DeckLists {

    private DeckLists() {}

    public static List<DeckCard> parseEntries(JsonNode entries) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (JsonNode entry : JsonFields.elements(entries)) {
            if (entry.isObject()) {
                int grpId = JsonFields.intValue(entry, "cardId", JsonFields.intValue(entry, "Id", 0));
                int quantity = JsonFields.intValue(entry, "quantity", JsonFields.intValue(entry, "Quantity", 1));
                if (grpId > 0 && quantity > 0) {
                    counts.merge(grpId, quantity, Integer::sum);
                }
            } else if (entry.isNumber() && entry.asInt() > 0) {
                counts.merge(entry.asInt(), 1, Integer::sum);
            }
        }
        return toDeckCards(counts);
    }

    /**
     * Counts duplicate ids into quantities.
     */
    public static List<DeckCard> countIds(List<Integer> grpIds) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (Integer grpId : grpIds) {
            if (grpId != null && grpId > 0) {
                counts.merge(grpId, 1, Integer::sum);
            }
        }
        return toDeckCards(counts);
    }

    /**
     * grpIds of a command-zone list, which uses the same entry shapes.
     */
    public static List<Integer> parseIds(JsonNode entries) {
        List<Integer> ids = new ArrayList<>();
        for (JsonNode entry : JsonFields.elements(entries)) {
            int grpId = entry.isObject()
                    ? JsonFields.intValue(entry, "cardId", JsonFields.intValue(entry, "Id", 0))
                    : entry.isNumber() ? entry.asInt() : 0;
            if (grpId > 0) {
                ids.add(grpId);
            }
        }
        return ids;
    }

    private static List<DeckCard> toDeckCards(Map<Integer, Integer> counts) {
        List<DeckCard> cards = new ArrayList<>(counts.size());
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            cards.add(new DeckCard(e.getKey(), e.getValue()));
        }
        return cards;
    }
}
