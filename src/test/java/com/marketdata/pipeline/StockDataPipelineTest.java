package com.marketdata.pipeline;

import com.marketdata.config.PipelineConfiguration;
import com.marketdata.persistence.StockDataStore;
import com.marketdata.pricing.PriceDataProvider;
import com.marketdata.pricing.PriceProviderRegistry;
import com.marketdata.pricing.ProviderKind;
import com.marketdata.pricing.StockPrice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StockDataPipelineTest {

    private static final StockPrice GOOGL_PRICE =
        new StockPrice("GOOGL", LocalDate.of(2024, 1, 2), 100.0, 101.0, 99.0, 100.5, 1_000_000L);
    private static final StockPrice NVDA_PRICE =
        new StockPrice("NVDA", LocalDate.of(2024, 1, 2), 480.0, 490.0, 475.0, 488.0, 5_000_000L);

    @Mock private PriceDataProvider alphaVantage;
    @Mock private PriceDataProvider yahoo;
    @Mock private StockDataStore store;

    private PriceProviderRegistry registry;

    @BeforeEach
    void setUp() {
        when(alphaVantage.kind()).thenReturn(ProviderKind.ALPHA_VANTAGE);
        when(yahoo.kind()).thenReturn(ProviderKind.YAHOO_FINANCE);
        registry = new PriceProviderRegistry(List.of(alphaVantage, yahoo));
    }

    private StockDataPipeline pipeline(String primary, String fallback, List<String> symbols) {
        PipelineConfiguration config = new PipelineConfiguration(primary, fallback, symbols, "key", null,
            Duration.ofSeconds(30), Duration.ofSeconds(12));
        FetchCoordinator coordinator = new FetchCoordinator(config, registry, () -> { });
        return new StockDataPipeline(config, new StockDataCollector(config, coordinator), store);
    }

    @Test
    void runPipeline_shouldStoreOnlySymbolsWithData_whenFallbackDisabled() {
        when(alphaVantage.fetchDailyPrices("GOOGL")).thenReturn(List.of(GOOGL_PRICE));
        when(alphaVantage.fetchDailyPrices("NVDA")).thenReturn(List.of());
        when(store.store(anyMap())).thenReturn(true);

        boolean success = pipeline("alpha_vantage", "alpha_vantage", List.of("GOOGL", "NVDA")).runPipeline();

        assertTrue(success);
        verify(store, times(1)).store(Map.of("GOOGL", List.of(GOOGL_PRICE)));
        verify(yahoo, never()).fetchDailyPrices(anyString());
    }

    @Test
    void runPipeline_shouldUseFallbackRecords_whenPrimaryHasNoData() {
        when(alphaVantage.fetchDailyPrices("NVDA")).thenReturn(List.of());
        when(yahoo.fetchDailyPrices("NVDA")).thenReturn(List.of(NVDA_PRICE));
        when(store.store(anyMap())).thenReturn(true);

        boolean success = pipeline("alpha_vantage", "yf", List.of("NVDA")).runPipeline();

        assertTrue(success);
        verify(yahoo, times(1)).fetchDailyPrices("NVDA");
        verify(store).store(Map.of("NVDA", List.of(NVDA_PRICE)));
    }

    @Test
    void runPipeline_shouldFailWithoutStoring_whenNoSourceHasData() {
        when(alphaVantage.fetchDailyPrices(anyString())).thenReturn(List.of());
        when(yahoo.fetchDailyPrices(anyString())).thenReturn(List.of());

        boolean success = pipeline("alpha_vantage", "yf", List.of("GOOGL", "NVDA")).runPipeline();

        assertFalse(success);
        verifyNoInteractions(store);
    }

    @Test
    void runPipeline_shouldFail_whenStoreRejectsBatch() {
        when(yahoo.fetchDailyPrices("GOOGL")).thenReturn(List.of(GOOGL_PRICE));
        when(store.store(anyMap())).thenReturn(false);

        assertFalse(pipeline("yf", "", List.of("GOOGL")).runPipeline());
    }

    @Test
    void runPipeline_shouldFail_whenStoreThrows() {
        when(yahoo.fetchDailyPrices("GOOGL")).thenReturn(List.of(GOOGL_PRICE));
        when(store.store(anyMap())).thenThrow(new IllegalStateException("pool exhausted"));

        assertFalse(pipeline("yf", "", List.of("GOOGL")).runPipeline());
    }

    @Test
    void runPipeline_shouldFail_whenCollectorThrows() throws Exception {
        PipelineConfiguration config = new PipelineConfiguration("yf", "", List.of("GOOGL"), "", null,
            Duration.ofSeconds(30), Duration.ofSeconds(12));
        StockDataCollector collector = mock(StockDataCollector.class);
        when(collector.collectAll()).thenThrow(new IllegalStateException("boom"));

        assertFalse(new StockDataPipeline(config, collector, store).runPipeline());
        verifyNoInteractions(store);
    }

    @Test
    void runPipeline_shouldRestoreInterruptFlag_whenInterrupted() throws Exception {
        PipelineConfiguration config = new PipelineConfiguration("alpha_vantage", "", List.of("GOOGL"), "key", null,
            Duration.ofSeconds(30), Duration.ofSeconds(12));
        StockDataCollector collector = mock(StockDataCollector.class);
        when(collector.collectAll()).thenThrow(new InterruptedException());

        try {
            assertFalse(new StockDataPipeline(config, collector, store).runPipeline());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void lastRun_shouldDescribeMostRecentRun() {
        when(alphaVantage.fetchDailyPrices("GOOGL")).thenReturn(List.of(GOOGL_PRICE));
        when(alphaVantage.fetchDailyPrices("NVDA")).thenReturn(List.of());
        when(store.store(anyMap())).thenReturn(true);
        StockDataPipeline pipeline = pipeline("alpha_vantage", "", List.of("GOOGL", "NVDA"));

        assertTrue(pipeline.lastRun().isEmpty());
        pipeline.runPipeline();

        PipelineRunSummary summary = pipeline.lastRun().orElseThrow();
        assertTrue(summary.success());
        assertEquals(List.of("GOOGL", "NVDA"), summary.symbolsRequested());
        assertEquals(List.of("GOOGL"), summary.symbolsWithData());
        assertEquals(1, summary.recordCount());
        assertFalse(summary.finishedAt().isBefore(summary.startedAt()));
    }
}
