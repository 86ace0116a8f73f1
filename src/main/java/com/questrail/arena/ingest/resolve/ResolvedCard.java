package com.questrail.arena.ingest.resolve;

import java.util.Objects;

/**
 * Card metadata for one grpId, and the tier it came from.
 *
 * <p>Everything except {@code name} may be null when the source did not carry
 * it; {@code cmc} is 0 in that case.</p>
 */
public record ResolvedCard(
        int grpId,
        String name,
        String manaCost,
        double cmc,
        String typeLine,
        String oracleText,
        String imageUriSmall,
        String imageUriNormal,
        Source source
) {
    /** Where a card's metadata was found. */
    public enum Source {
        /** The persistent {@code grp_id_cache} table. */
        CACHE,
        /** The card catalog, matched by its Arena id column. */
        CATALOG,
        /** The remote lookup service. */
        REMOTE,
        /** Synthesized; nothing was known. */
        PLACEHOLDER
    }

    public ResolvedCard {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }

    public static ResolvedCard placeholder(int grpId) {
        return placeholder(grpId, "Unknown (grpId: " + grpId + ")");
    }

    /**
     * Placeholder carrying a name learned elsewhere, such as a name seen
     * inline on a game object.
     */
    public static ResolvedCard placeholder(int grpId, String name) {
        return new ResolvedCard(grpId, name, null, 0, null, null, null, null, Source.PLACEHOLDER);
    }

    public boolean isPlaceholder() {
        return source == Source.PLACEHOLDER;
    }

    ResolvedCard withSource(Source source) {
        return new ResolvedCard(grpId, name, manaCost, cmc, typeLine, oracleText, imageUriSmall, imageUriNormal, source);
    }
}
