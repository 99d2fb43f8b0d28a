package com.flagship.media_ledger.webhook;

import java.util.Arrays;
import java.util.Optional;

/**
 * Token packages sold through checkout. The webhook credits the catalogue
 * amount, never an amount taken from the event.
 */
public enum TokenPackage {
    TASTING("tasting", "Tasting Pack", 20, 99),
    STARTER("starter", "Starter Pack", 110, 499),
    POPULAR("popular", "Popular Pack", 220, 999),
    CREATOR("creator", "Creator Pack", 500, 1999),
    STUDIO("studio", "Studio Pack", 1400, 4999);

    private final String id;
    private final String displayName;
    private final long tokens;
    private final long priceCents;

    TokenPackage(String id, String displayName, long tokens, long priceCents) {
        this.id = id;
        this.displayName = displayName;
        this.tokens = tokens;
        this.priceCents = priceCents;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getTokens() {
        return tokens;
    }

    public long getPriceCents() {
        return priceCents;
    }

    public static Optional<TokenPackage> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(p -> p.id.equalsIgnoreCase(id.trim()))
            .findFirst();
    }
}
