package com.marketdata.pipeline;

import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Triggers the pipeline once a day while the application runs in serve mode.
 */
@Singleton
@Requires(property = "pipeline.schedule.enabled", value = "true")
public class ScheduledPipelineJob {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduledPipelineJob.class);

    private final StockDataPipeline pipeline;

    public ScheduledPipelineJob(StockDataPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Scheduled(cron = "${pipeline.schedule.cron}", zoneId = "${pipeline.schedule.zone-id}")
    public void runDaily() {
        LOG.info("==> Scheduled stock data pipeline FIRED");
        if (!pipeline.runPipeline()) {
            LOG.error("Scheduled pipeline run failed");
        }
    }
}
