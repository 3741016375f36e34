package com.marketdata.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of a TIME_SERIES_DAILY response. Exactly one of the fields is normally set:
 * the series on success, or one of the error / throttling messages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageDailyResponse(
    @JsonProperty("Error Message") String errorMessage,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Time Series (Daily)") Map<String, AlphaVantageDailyBar> timeSeries
) {

    public boolean hasError() {
        return errorMessage != null;
    }

    /**
     * Alpha Vantage reports throttling as a 200 with a "Note" (older) or "Information" (newer) field.
     */
    public boolean isRateLimited() {
        return note != null || information != null;
    }

    public String rateLimitMessage() {
        return note != null ? note : information;
    }

    public boolean hasTimeSeries() {
        return timeSeries != null;
    }
}
