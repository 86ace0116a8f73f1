package com.questrail.arena.ingest.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.arena.ingest.config.ResolverConfig;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RemoteCardLookup} over HTTP using {@link java.net.http.HttpClient}.
 *
 * <p>Issues {@code GET <base>/<grpId>} and maps the JSON card object. For
 * multi-face cards the mana cost, oracle text and images fall back to the
 * first face when the top level lacks them. A 404 is an unknown id; any other
 * non-2xx status, an I/O error or an unreadable body is a
 * {@link RemoteLookupException}.</p>
 */
public final class HttpRemoteCardLookup implements RemoteCardLookup {

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final ResolverConfig config;

    public HttpRemoteCardLookup(ResolverConfig config) {
        this(HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build(), new ObjectMapper(), config);
    }

    public HttpRemoteCardLookup(HttpClient http, ObjectMapper mapper, ResolverConfig config) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public Optional<ResolvedCard> lookup(int grpId) {
        HttpRequest request = HttpRequest.newBuilder(uriFor(grpId))
                .GET()
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .header("Accept", "application/json")
                .build();

        HttpResponse<byte[]> resp;
        try {
            resp = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new RemoteLookupException("Lookup of grpId " + grpId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteLookupException("Lookup of grpId " + grpId + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new RemoteLookupException("Lookup of grpId " + grpId + " returned HTTP " + status);
        }

        JsonNode card;
        try {
            card = mapper.readTree(resp.body() == null ? new byte[0] : resp.body());
        } catch (IOException e) {
            throw new RemoteLookupException("Unreadable response for grpId " + grpId, e);
        }
        return Optional.ofNullable(fromJson(grpId, card));
    }

    URI uriFor(int grpId) {
        String base = config.remoteBaseUri().toString();
        return URI.create(base.endsWith("/") ? base + grpId : base + "/" + grpId);
    }

    /**
     * Maps a card object; returns null when it carries no name.
     */
    static ResolvedCard fromJson(int grpId, JsonNode card) {
        if (card == null || !card.isObject() || !card.hasNonNull("name")) {
            return null;
        }
        JsonNode faces = card.get("card_faces");
        JsonNode front = faces != null && faces.isArray() && faces.size() > 0 ? faces.get(0) : null;
        JsonNode images = card.get("image_uris");
        JsonNode frontImages = front != null ? front.get("image_uris") : null;

        return new ResolvedCard(
                grpId,
                card.get("name").asText(),
                firstText(card, front, "mana_cost"),
                card.path("cmc").asDouble(0),
                text(card, "type_line"),
                firstText(card, front, "oracle_text"),
                firstText(images, frontImages, "small"),
                firstText(images, frontImages, "normal"),
                ResolvedCard.Source.REMOTE);
    }

    private static String firstText(JsonNode primary, JsonNode fallback, String field) {
        String value = text(primary, field);
        return value != null ? value : text(fallback, field);
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
