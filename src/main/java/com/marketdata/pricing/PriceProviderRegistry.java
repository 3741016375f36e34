package com.marketdata.pricing;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves configured provider identifiers to {@link PriceDataProvider} beans.
 * Unknown identifiers are a no-data outcome, never a startup failure.
 */
@Singleton
public class PriceProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(PriceProviderRegistry.class);

    private final Map<ProviderKind, PriceDataProvider> providers = new EnumMap<>(ProviderKind.class);

    public PriceProviderRegistry(Collection<PriceDataProvider> providers) {
        for (PriceDataProvider provider : providers) {
            PriceDataProvider previous = this.providers.put(provider.kind(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two providers registered for " + provider.kind()
                    + ": " + previous.getProviderName() + " and " + provider.getProviderName());
            }
        }
        LOG.info("Registered price providers: {}", this.providers.keySet());
    }

    public Optional<PriceDataProvider> find(String providerId) {
        return ProviderKind.fromId(providerId).map(providers::get);
    }

    /**
     * Fetches from the provider named by {@code providerId}.
     *
     * @return the provider's records, or an empty list if the identifier is unknown
     */
    public List<StockPrice> fetch(String providerId, String symbol) {
        Optional<PriceDataProvider> provider = find(providerId);
        if (provider.isEmpty()) {
            LOG.error("Unknown data source: '{}'", providerId);
            return List.of();
        }
        return provider.get().fetchDailyPrices(symbol);
    }
}
