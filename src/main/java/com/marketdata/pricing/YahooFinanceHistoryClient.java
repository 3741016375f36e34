package com.marketdata.pricing;

import jakarta.inject.Singleton;
import yahoofinance.Stock;
import yahoofinance.YahooFinance;
import yahoofinance.histquotes.HistoricalQuote;
import yahoofinance.histquotes.Interval;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;

/**
 * {@link YahooHistoryClient} backed by the YahooFinanceAPI library.
 */
@Singleton
public class YahooFinanceHistoryClient implements YahooHistoryClient {

    @Override
    public List<YahooQuoteRow> fetchDailyHistory(String symbol, int trailingDays) throws IOException {
        Calendar to = Calendar.getInstance();
        Calendar from = Calendar.getInstance();
        from.add(Calendar.DAY_OF_MONTH, -trailingDays);

        Stock stock = YahooFinance.get(symbol, from, to, Interval.DAILY);
        if (stock == null) {
            return List.of();
        }
        List<HistoricalQuote> history = stock.getHistory();
        if (history == null) {
            return List.of();
        }

        List<YahooQuoteRow> rows = new ArrayList<>(history.size());
        for (HistoricalQuote quote : history) {
            rows.add(new YahooQuoteRow(
                toZonedDateTime(quote.getDate()),
                quote.getOpen(),
                quote.getHigh(),
                quote.getLow(),
                quote.getClose(),
                quote.getVolume()
            ));
        }
        return rows;
    }

    // The library builds its calendars in the JVM default zone
    static ZonedDateTime toZonedDateTime(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return calendar.toInstant().atZone(calendar.getTimeZone().toZoneId());
    }
}
