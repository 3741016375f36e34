package com.marketdata.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the Alpha Vantage daily time series. Values arrive as strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageDailyBar(
    @JsonProperty("1. open") String open,
    @JsonProperty("2. high") String high,
    @JsonProperty("3. low") String low,
    @JsonProperty("4. close") String close,
    @JsonProperty("5. volume") String volume
) {}
