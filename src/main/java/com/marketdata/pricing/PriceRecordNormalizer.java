package com.marketdata.pricing;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts provider payloads into {@link StockPrice} records.
 * Invalid entries are skipped with a warning; the rest of the batch is kept.
 */
@Singleton
public class PriceRecordNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(PriceRecordNormalizer.class);

    /**
     * Normalizes an Alpha Vantage daily series (date string to bar).
     * Volume is parsed as a decimal and truncated, some feeds send "123.0".
     */
    public List<StockPrice> normalizeAlphaVantage(Map<String, AlphaVantageDailyBar> timeSeries, String symbol) {
        Map<LocalDate, StockPrice> byDate = new LinkedHashMap<>();

        for (Map.Entry<String, AlphaVantageDailyBar> entry : timeSeries.entrySet()) {
            String dateStr = entry.getKey();
            AlphaVantageDailyBar bar = entry.getValue();
            try {
                if (bar == null) {
                    throw new InvalidRecordException("empty bar");
                }
                StockPrice price = new StockPrice(
                    symbol,
                    parseDate(dateStr),
                    parsePrice(bar.open(), "open"),
                    parsePrice(bar.high(), "high"),
                    parsePrice(bar.low(), "low"),
                    parsePrice(bar.close(), "close"),
                    parseVolume(bar.volume())
                );
                put(byDate, price);
            } catch (InvalidRecordException e) {
                LOG.warn("Skipping invalid record for {} on {}: {}", symbol, dateStr, e.getMessage());
            }
        }

        LOG.info("Parsed {} records for {}", byDate.size(), symbol);
        return new ArrayList<>(byDate.values());
    }

    /**
     * Normalizes Yahoo Finance daily rows. The row timestamp is reduced to its calendar date.
     */
    public List<StockPrice> normalizeYahoo(List<YahooQuoteRow> rows, String symbol) {
        Map<LocalDate, StockPrice> byDate = new LinkedHashMap<>();

        for (YahooQuoteRow row : rows) {
            try {
                if (row == null || row.timestamp() == null) {
                    throw new InvalidRecordException("missing date");
                }
                StockPrice price = new StockPrice(
                    symbol,
                    row.timestamp().toLocalDate(),
                    checkPrice(row.open(), "open"),
                    checkPrice(row.high(), "high"),
                    checkPrice(row.low(), "low"),
                    checkPrice(row.close(), "close"),
                    checkVolume(row.volume())
                );
                put(byDate, price);
            } catch (InvalidRecordException e) {
                LOG.warn("Skipping invalid record for {} on {}: {}",
                    symbol, row == null ? null : row.timestamp(), e.getMessage());
            }
        }

        LOG.info("Parsed {} records for {}", byDate.size(), symbol);
        return new ArrayList<>(byDate.values());
    }

    // A repeated date keeps its first position and takes the later values.
    private void put(Map<LocalDate, StockPrice> byDate, StockPrice price) {
        if (byDate.put(price.date(), price) != null) {
            LOG.warn("Duplicate bar for {} on {}, keeping the latest values", price.symbol(), price.date());
        }
    }

    private LocalDate parseDate(String value) {
        if (value == null) {
            throw new InvalidRecordException("missing date");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException("unparseable date '" + value + "'");
        }
    }

    private double parsePrice(String value, String field) {
        if (value == null) {
            throw new InvalidRecordException("missing " + field);
        }
        try {
            return checkPrice(Double.parseDouble(value.trim()), field);
        } catch (NumberFormatException e) {
            throw new InvalidRecordException("non-numeric " + field + " '" + value + "'");
        }
    }

    private long parseVolume(String value) {
        if (value == null) {
            throw new InvalidRecordException("missing volume");
        }
        double volume;
        try {
            volume = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRecordException("non-numeric volume '" + value + "'");
        }
        if (!Double.isFinite(volume) || volume < 0) {
            throw new InvalidRecordException("invalid volume " + value);
        }
        return (long) volume;
    }

    private double checkPrice(BigDecimal value, String field) {
        if (value == null) {
            throw new InvalidRecordException("missing " + field);
        }
        return checkPrice(value.doubleValue(), field);
    }

    private double checkPrice(double value, String field) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidRecordException("invalid " + field + " " + value);
        }
        return value;
    }

    private long checkVolume(Long value) {
        if (value == null) {
            throw new InvalidRecordException("missing volume");
        }
        if (value < 0) {
            throw new InvalidRecordException("invalid volume " + value);
        }
        return value;
    }

    private static final class InvalidRecordException extends RuntimeException {
        InvalidRecordException(String message) {
            super(message, null, false, false);
        }
    }
}
