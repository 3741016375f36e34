package com.marketdata.pricing;

import java.time.LocalDate;

/**
 * Canonical daily OHLCV record, keyed by (symbol, date). Provider agnostic.
 */
public record StockPrice(
    String symbol,
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    long volume
) {}
