package com.marketdata.pricing;

import java.util.Locale;
import java.util.Optional;

/**
 * Market data sources the pipeline knows how to call.
 */
public enum ProviderKind {
    ALPHA_VANTAGE("alpha_vantage", true),
    YAHOO_FINANCE("yf", false);

    private final String id;
    private final boolean rateLimited;

    ProviderKind(String id, boolean rateLimited) {
        this.id = id;
        this.rateLimited = rateLimited;
    }

    public String id() {
        return id;
    }

    /**
     * Whether consecutive symbols must be spaced out when this source is the primary.
     */
    public boolean isRateLimited() {
        return rateLimited;
    }

    public static Optional<ProviderKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
