package com.marketdata.pipeline;

import com.marketdata.config.PipelineConfiguration;
import com.marketdata.pricing.StockPrice;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every configured symbol through the {@link FetchCoordinator}, in order.
 */
@Singleton
public class StockDataCollector {
    private static final Logger LOG = LoggerFactory.getLogger(StockDataCollector.class);

    private final PipelineConfiguration config;
    private final FetchCoordinator coordinator;

    public StockDataCollector(PipelineConfiguration config, FetchCoordinator coordinator) {
        this.config = config;
        this.coordinator = coordinator;
    }

    /**
     * @return records per symbol in configured order; symbols without data are left out
     */
    public Map<String, List<StockPrice>> collectAll() throws InterruptedException {
        List<String> symbols = config.symbols();
        Map<String, List<StockPrice>> result = new LinkedHashMap<>();

        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            List<StockPrice> prices = coordinator.fetchSymbol(symbol);
            if (prices.isEmpty()) {
                LOG.warn("No data for {} from any source", symbol);
            } else {
                result.put(symbol, prices);
            }

            if (i < symbols.size() - 1) {
                coordinator.awaitNextSymbol();
            }
        }

        LOG.info("Collected data for {}/{} symbols", result.size(), symbols.size());
        return result;
    }
}
