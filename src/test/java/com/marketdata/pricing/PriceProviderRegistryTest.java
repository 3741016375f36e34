package com.marketdata.pricing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PriceProviderRegistryTest {

    @Mock private PriceDataProvider alphaVantage;
    @Mock private PriceDataProvider yahoo;

    private PriceProviderRegistry registry;

    @BeforeEach
    void setUp() {
        when(alphaVantage.kind()).thenReturn(ProviderKind.ALPHA_VANTAGE);
        when(yahoo.kind()).thenReturn(ProviderKind.YAHOO_FINANCE);
        registry = new PriceProviderRegistry(List.of(alphaVantage, yahoo));
    }

    @Test
    void fetch_shouldDispatchByIdentifier() {
        StockPrice price = new StockPrice("GOOGL", LocalDate.of(2024, 1, 2), 100.0, 101.0, 99.0, 100.5, 1_000_000L);
        when(yahoo.fetchDailyPrices("GOOGL")).thenReturn(List.of(price));

        assertEquals(List.of(price), registry.fetch("yf", "GOOGL"));
        verify(alphaVantage, never()).fetchDailyPrices(anyString());
    }

    @Test
    void fetch_shouldReturnEmpty_forUnknownIdentifier() {
        assertTrue(registry.fetch("bloomberg", "GOOGL").isEmpty());
        assertTrue(registry.fetch("", "GOOGL").isEmpty());
        assertTrue(registry.fetch(null, "GOOGL").isEmpty());

        verify(alphaVantage, never()).fetchDailyPrices(anyString());
        verify(yahoo, never()).fetchDailyPrices(anyString());
    }

    @Test
    void find_shouldMatchIdentifiersCaseInsensitively() {
        assertSame(alphaVantage, registry.find("ALPHA_VANTAGE").orElseThrow());
        assertTrue(registry.find("alpha-vantage").isEmpty());
    }
}
