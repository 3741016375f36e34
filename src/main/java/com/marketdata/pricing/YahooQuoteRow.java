package com.marketdata.pricing;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

/**
 * One daily row from the Yahoo Finance history, decoupled from the vendor's types.
 * Any field may be null when Yahoo leaves a gap.
 */
public record YahooQuoteRow(
    ZonedDateTime timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    Long volume
) {}
