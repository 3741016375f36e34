package com.marketdata.pipeline;

import com.marketdata.config.PipelineConfiguration;
import com.marketdata.persistence.StockDataStore;
import com.marketdata.pricing.StockPrice;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of a daily run: collect prices for every symbol, then store the whole batch once.
 * Never throws; every failure ends up as a {@code false} result.
 */
@Singleton
public class StockDataPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(StockDataPipeline.class);

    private final PipelineConfiguration config;
    private final StockDataCollector collector;
    private final StockDataStore store;
    private final AtomicReference<PipelineRunSummary> lastRun = new AtomicReference<>();

    public StockDataPipeline(PipelineConfiguration config, StockDataCollector collector, StockDataStore store) {
        this.config = config;
        this.collector = collector;
        this.store = store;
    }

    /**
     * @return true iff at least one symbol produced data and the store accepted the batch
     */
    public boolean runPipeline() {
        Instant startedAt = Instant.now();
        Map<String, List<StockPrice>> stockData = Map.of();
        boolean success = false;

        try {
            LOG.info("Starting stock data pipeline with source={}, fallback={}",
                config.dataSource(), config.fallbackSource());

            stockData = collector.collectAll();

            if (stockData.isEmpty()) {
                LOG.error("No data fetched, exiting");
            } else if (store.store(stockData)) {
                LOG.info("Pipeline completed successfully");
                success = true;
            } else {
                LOG.error("Pipeline failed: storing {} symbols was rejected", stockData.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Pipeline interrupted");
        } catch (Exception e) {
            LOG.error("Pipeline failed", e);
        }

        lastRun.set(new PipelineRunSummary(
            startedAt,
            Instant.now(),
            config.symbols(),
            List.copyOf(stockData.keySet()),
            stockData.values().stream().mapToInt(List::size).sum(),
            success
        ));
        return success;
    }

    public Optional<PipelineRunSummary> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }
}
