package com.marketdata.pipeline;

import com.marketdata.config.PipelineConfiguration;
import com.marketdata.pricing.ProviderKind;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Waits a fixed delay between symbols when the primary source is rate limited
 * (Alpha Vantage free tier: 5 calls/min, so 12s per symbol). Other sources are not paced.
 * A pending wait ends early once {@link #cancel()} is called.
 */
@Singleton
public class RateLimitPacingPolicy implements PacingPolicy {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimitPacingPolicy.class);

    private final Duration delay;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public RateLimitPacingPolicy(PipelineConfiguration config) {
        boolean rateLimited = ProviderKind.fromId(config.dataSource())
            .map(ProviderKind::isRateLimited)
            .orElse(false);
        this.delay = rateLimited ? config.pacingDelay() : Duration.ZERO;
    }

    public Duration delay() {
        return delay;
    }

    @Override
    public void awaitNextSymbol() throws InterruptedException {
        if (delay.isZero() || delay.isNegative() || cancelled.getCount() == 0) {
            return;
        }
        LOG.info("Waiting {}s to respect API rate limits...", delay.toSeconds());
        if (cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.info("Rate limit wait cancelled");
        }
    }

    @PreDestroy
    public void cancel() {
        cancelled.countDown();
    }
}
