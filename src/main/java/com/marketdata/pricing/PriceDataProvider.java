package com.marketdata.pricing;

import java.util.List;

/**
 * Provider interface for fetching recent daily stock prices from a market data source.
 * Implementations absorb their own transport and parsing failures.
 */
public interface PriceDataProvider {

    /**
     * Fetches the most recent daily bars the source offers for a symbol.
     *
     * @param symbol Stock ticker symbol (e.g., "GOOGL", "NVDA")
     * @return normalized records in the order the source returned them, or an empty list
     *         when the source produced nothing usable
     */
    List<StockPrice> fetchDailyPrices(String symbol);

    /**
     * The source this provider talks to.
     */
    ProviderKind kind();

    /**
     * Returns the provider name for logging.
     */
    String getProviderName();
}
