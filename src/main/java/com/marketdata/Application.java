package com.marketdata;

import com.marketdata.pipeline.StockDataPipeline;
import io.github.cdimascio.dotenv.Dotenv;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.PropertySource;
import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs the stock data pipeline once and exits with 0 on success, 1 otherwise.
 * With {@code --serve} the application keeps running and triggers the pipeline on its cron schedule.
 */
public class Application {
    private static final Logger LOG = LoggerFactory.getLogger(Application.class);
    private static final String SERVE_FLAG = "--serve";

    public static void main(String[] args) {
        // Load .env file BEFORE Micronaut starts
        PropertySource dotenv = loadDotenv();

        if (Arrays.asList(args).contains(SERVE_FLAG)) {
            Micronaut.build(args)
                .mainClass(Application.class)
                .propertySources(dotenv)
                .properties(Map.<String, Object>of("pipeline.schedule.enabled", "true"))
                .start();
            return;
        }

        System.exit(runOnce(args, dotenv) ? 0 : 1);
    }

    static boolean runOnce(String[] args, PropertySource dotenv) {
        try (ApplicationContext context = ApplicationContext.builder()
                .args(args)
                .propertySources(dotenv)
                .start()) {
            return context.getBean(StockDataPipeline.class).runPipeline();
        } catch (Exception e) {
            LOG.error("Pipeline failed to start", e);
            return false;
        }
    }

    /**
     * .env entries are read with environment variable naming (DB_HOST becomes db.host).
     * Variables already set in the real environment take precedence.
     */
    static PropertySource loadDotenv() {
        try {
            Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
            return dotenvPropertySource(dotenv, System.getenv());
        } catch (Exception e) {
            LOG.warn("Could not load .env file - {}", e.getMessage());
            return dotenvPropertySource(Map.of());
        }
    }

    static PropertySource dotenvPropertySource(Dotenv dotenv, Map<String, String> environment) {
        Map<String, Object> values = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).forEach(entry -> {
            // Only set if not already in environment
            if (!environment.containsKey(entry.getKey())) {
                values.put(entry.getKey(), entry.getValue());
            }
        });
        LOG.debug("Loaded {} variables from .env", values.size());
        return dotenvPropertySource(values);
    }

    private static PropertySource dotenvPropertySource(Map<String, Object> values) {
        return PropertySource.of("dotenv", values, PropertySource.PropertyConvention.ENVIRONMENT_VARIABLE);
    }
}
