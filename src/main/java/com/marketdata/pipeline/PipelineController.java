package com.marketdata.pipeline;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;

@Controller("/pipeline")
public class PipelineController {
    private final StockDataPipeline pipeline;

    public PipelineController(StockDataPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Get("/last-run")
    public HttpResponse<PipelineRunSummary> lastRun() {
        return pipeline.lastRun()
            .map(HttpResponse::ok)
            .orElseGet(HttpResponse::notFound);
    }
}
