package com.marketdata.persistence;

import com.marketdata.pricing.StockPrice;

import java.util.List;
import java.util.Map;

/**
 * Durable sink for collected prices.
 */
public interface StockDataStore {

    /**
     * Upserts every record keyed by (symbol, date), all or nothing.
     *
     * @return false if nothing was written, including when the batch is empty
     */
    boolean store(Map<String, List<StockPrice>> recordsBySymbol);
}
