package com.marketdata.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketdata.config.PipelineConfiguration;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientException;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.client.exceptions.ReadTimeoutException;
import io.micronaut.http.uri.UriBuilder;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;

/**
 * Alpha Vantage TIME_SERIES_DAILY endpoint.
 * Free tier allows 5 requests/min, callers are expected to pace symbols.
 * The request is bounded by the shared client's read timeout ({@code pipeline.api-timeout}).
 */
@Singleton
public class AlphaVantagePriceProvider implements PriceDataProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AlphaVantagePriceProvider.class);

    private final PipelineConfiguration config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PriceRecordNormalizer normalizer;

    public AlphaVantagePriceProvider(
            PipelineConfiguration config,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            PriceRecordNormalizer normalizer) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        LOG.info("AlphaVantagePriceProvider initialized against {} (timeout {}s)",
            config.alphaVantageBaseUrl(), config.apiTimeout().toSeconds());
    }

    @Override
    public List<StockPrice> fetchDailyPrices(String symbol) {
        if (!config.hasAlphaVantageApiKey()) {
            LOG.error("No Alpha Vantage API key configured, skipping {}", symbol);
            return List.of();
        }

        try {
            LOG.info("[Alpha Vantage] Fetching data for {}", symbol);
            URI uri = UriBuilder.of(config.alphaVantageBaseUrl())
                    .path("/query")
                    .queryParam("function", "TIME_SERIES_DAILY")
                    .queryParam("symbol", symbol)
                    .queryParam("apikey", config.alphaVantageApiKey())
                    .build();

            String response = httpClient.toBlocking().retrieve(uri.toString());
            if (response == null || response.isBlank()) {
                LOG.warn("Alpha Vantage returned an empty body for {}", symbol);
                return List.of();
            }

            AlphaVantageDailyResponse body = objectMapper.readValue(response, AlphaVantageDailyResponse.class);

            if (body.hasError()) {
                LOG.error("API Error for {}: {}", symbol, body.errorMessage());
                return List.of();
            }
            if (body.isRateLimited()) {
                LOG.warn("Rate limit exceeded: {}", body.rateLimitMessage());
                return List.of();
            }
            if (!body.hasTimeSeries()) {
                LOG.warn("No time series data for {}: {}", symbol, response);
                return List.of();
            }

            return normalizer.normalizeAlphaVantage(body.timeSeries(), symbol);

        } catch (ReadTimeoutException e) {
            LOG.error("Timeout fetching data for {}", symbol);
        } catch (HttpClientResponseException e) {
            LOG.error("Alpha Vantage responded {} for {}", e.getStatus(), symbol);
        } catch (HttpClientException e) {
            LOG.error("Network error for {}: {}", symbol, e.getMessage());
        } catch (JsonProcessingException e) {
            LOG.error("JSON parsing error for {}: {}", symbol, e.getOriginalMessage());
        } catch (Exception e) {
            LOG.error("Failed to fetch prices from Alpha Vantage for {}", symbol, e);
        }
        return List.of();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ALPHA_VANTAGE;
    }

    @Override
    public String getProviderName() {
        return "Alpha Vantage";
    }
}
