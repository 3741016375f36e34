package com.marketdata.pricing;

import java.io.IOException;
import java.util.List;

/**
 * Access to Yahoo Finance daily history.
 */
public interface YahooHistoryClient {

    /**
     * Daily rows for the trailing window ending now.
     *
     * @return rows in the order Yahoo returned them; empty when the symbol is unknown
     */
    List<YahooQuoteRow> fetchDailyHistory(String symbol, int trailingDays) throws IOException;
}
