package com.marketdata.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable pipeline settings bound from the {@code pipeline} block of application.yml.
 * Provider identifiers are lowercased and symbols uppercased on construction;
 * unknown identifiers are kept as-is and rejected later at dispatch time.
 */
@ConfigurationProperties("pipeline")
public record PipelineConfiguration(
    String dataSource,
    @Nullable String fallbackSource,
    List<String> symbols,
    @Nullable String alphaVantageApiKey,
    String alphaVantageBaseUrl,
    Duration apiTimeout,
    Duration pacingDelay
) {

    public static final String DEFAULT_ALPHA_VANTAGE_URL = "https://www.alphavantage.co";

    public PipelineConfiguration {
        dataSource = normalizeId(dataSource);
        fallbackSource = normalizeId(fallbackSource);
        symbols = symbols == null ? List.of() : symbols.stream()
            .filter(Objects::nonNull)
            .map(s -> s.trim().toUpperCase(Locale.ROOT))
            .filter(s -> !s.isEmpty())
            .toList();
        alphaVantageApiKey = alphaVantageApiKey == null ? "" : alphaVantageApiKey.trim();
        alphaVantageBaseUrl = alphaVantageBaseUrl == null || alphaVantageBaseUrl.isBlank()
            ? DEFAULT_ALPHA_VANTAGE_URL : alphaVantageBaseUrl.trim();
        apiTimeout = apiTimeout == null ? Duration.ofSeconds(30) : apiTimeout;
        pacingDelay = pacingDelay == null ? Duration.ofSeconds(12) : pacingDelay;
    }

    /**
     * The fallback identifier, present only when it is set and differs from the primary.
     */
    public Optional<String> effectiveFallback() {
        if (fallbackSource.isEmpty() || fallbackSource.equals(dataSource)) {
            return Optional.empty();
        }
        return Optional.of(fallbackSource);
    }

    public boolean hasAlphaVantageApiKey() {
        return !alphaVantageApiKey.isEmpty();
    }

    private static String normalizeId(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }
}
