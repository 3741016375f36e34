package com.marketdata.pipeline;

import com.marketdata.config.PipelineConfiguration;
import com.marketdata.pricing.PriceProviderRegistry;
import com.marketdata.pricing.StockPrice;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Fetches one symbol from the primary source, falling back to the secondary source
 * when the primary produced nothing. Each source is tried at most once per symbol.
 */
@Singleton
public class FetchCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(FetchCoordinator.class);

    private final PipelineConfiguration config;
    private final PriceProviderRegistry registry;
    private final PacingPolicy pacingPolicy;

    public FetchCoordinator(PipelineConfiguration config, PriceProviderRegistry registry, PacingPolicy pacingPolicy) {
        this.config = config;
        this.registry = registry;
        this.pacingPolicy = pacingPolicy;
    }

    public List<StockPrice> fetchSymbol(String symbol) {
        LOG.info("Fetching {} using {}", symbol, config.dataSource());
        List<StockPrice> prices = registry.fetch(config.dataSource(), symbol);
        if (!prices.isEmpty()) {
            return prices;
        }

        Optional<String> fallback = config.effectiveFallback();
        if (fallback.isEmpty()) {
            return List.of();
        }

        LOG.warn("Primary source '{}' failed for {}. Falling back to '{}'",
            config.dataSource(), symbol, fallback.get());
        return registry.fetch(fallback.get(), symbol);
    }

    /**
     * Called between two symbols of the same run, never after the last one.
     */
    public void awaitNextSymbol() throws InterruptedException {
        pacingPolicy.awaitNextSymbol();
    }
}
