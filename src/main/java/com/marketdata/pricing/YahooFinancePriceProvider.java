package com.marketdata.pricing;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Yahoo Finance daily bars through the vendor library. Not rate limited.
 */
@Singleton
public class YahooFinancePriceProvider implements PriceDataProvider {
    private static final Logger LOG = LoggerFactory.getLogger(YahooFinancePriceProvider.class);
    static final int TRAILING_DAYS = 5;

    private final YahooHistoryClient historyClient;
    private final PriceRecordNormalizer normalizer;

    public YahooFinancePriceProvider(YahooHistoryClient historyClient, PriceRecordNormalizer normalizer) {
        this.historyClient = historyClient;
        this.normalizer = normalizer;
    }

    @Override
    public List<StockPrice> fetchDailyPrices(String symbol) {
        try {
            LOG.info("[Yahoo Finance] Fetching data for {}", symbol);
            List<YahooQuoteRow> rows = historyClient.fetchDailyHistory(symbol, TRAILING_DAYS);

            if (rows == null || rows.isEmpty()) {
                LOG.warn("No yfinance data for {}", symbol);
                return List.of();
            }

            return normalizer.normalizeYahoo(rows, symbol);
        } catch (Exception e) {
            LOG.error("Error fetching {} from yfinance: {}", symbol, e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.YAHOO_FINANCE;
    }

    @Override
    public String getProviderName() {
        return "Yahoo Finance";
    }
}
