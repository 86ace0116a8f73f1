package com.questrail.arena.ingest.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes {@link TelemetryBatch}es as JSON for delivery to a persistence
 * endpoint.
 *
 * <p>Field names are snake_case: {@code actions[]} with {@code match_id},
 * {@code game_number}, {@code turn_number}, {@code phase},
 * {@code action_type}, {@code player}, {@code grp_id}, {@code card_name},
 * {@code details} (a JSON string) and {@code action_order}; and, on a final
 * batch, {@code summary}.</p>
 */
public final class TelemetryBatchCodec {

    private final ObjectMapper mapper;

    public TelemetryBatchCodec() {
        this(new ObjectMapper());
    }

    public TelemetryBatchCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectNode encode(TelemetryBatch batch) {
        Objects.requireNonNull(batch, "batch");
        ObjectNode root = mapper.createObjectNode();
        ArrayNode actions = root.putArray("actions");
        for (TelemetryAction action : batch.actions()) {
            actions.add(encodeAction(action));
        }
        if (batch.hasSummary()) {
            root.set("summary", encodeSummary(batch.summary()));
        }
        return root;
    }

    /**
     * @throws TelemetryEncodingException if serialization fails
     */
    public byte[] writeBytes(TelemetryBatch batch) {
        try {
            return mapper.writeValueAsBytes(encode(batch));
        } catch (JsonProcessingException e) {
            throw new TelemetryEncodingException("Failed to serialize telemetry batch", e);
        }
    }

    private ObjectNode encodeAction(TelemetryAction action) {
        ObjectNode node = mapper.createObjectNode();
        node.put("match_id", action.matchId());
        node.put("game_number", action.gameNumber());
        node.put("turn_number", action.turnNumber());
        node.put("phase", action.phase());
        node.put("action_type", action.actionType().wireName());
        node.put("player", action.player().wireName());
        node.put("grp_id", action.grpId());
        node.put("card_name", action.cardName());
        ObjectNode details = action.details();
        if (details != null) {
            node.put("details", details.toString());
        } else {
            node.putNull("details");
        }
        node.put("action_order", action.actionOrder());
        return node;
    }

    private ObjectNode encodeSummary(MatchTelemetrySummary summary) {
        ObjectNode node = mapper.createObjectNode();
        node.put("match_id", summary.matchId());
        ints(node.putArray("opening_hand"), summary.openingHand());
        node.put("mulligan_count", summary.mulliganCount());
        node.put("on_play", summary.onPlay());
        node.put("match_start_time", summary.matchStartTime() != null ? summary.matchStartTime().toString() : null);
        node.put("match_end_time", summary.matchEndTime() != null ? summary.matchEndTime().toString() : null);
        node.put("game_count", summary.gameCount());
        node.put("result", summary.result());

        ArrayNode life = node.putArray("life_progression");
        for (LifeSnapshot s : summary.lifeProgression()) {
            life.addObject()
                    .put("turn", s.turn())
                    .put("player", s.playerLife())
                    .put("opponent", s.opponentLife());
        }

        ints(node.putArray("draw_order"), summary.drawOrder());

        ArrayNode changes = node.putArray("sideboard_changes");
        for (SideboardChange change : summary.sideboardChanges()) {
            ObjectNode c = changes.addObject();
            c.put("game", change.game());
            ints(c.putArray("in"), change.boardedIn());
            ints(c.putArray("out"), change.boardedOut());
        }

        ObjectNode byTurn = node.putObject("opponent_cards_by_turn");
        for (Map.Entry<Integer, List<Integer>> e : summary.opponentCardsByTurn().entrySet()) {
            ints(byTurn.putArray(Integer.toString(e.getKey())), e.getValue());
        }
        return node;
    }

    private static void ints(ArrayNode array, List<Integer> values) {
        values.forEach(array::add);
    }
}
