package com.execmetrics.config;

import com.execmetrics.domain.enums.SlippageSignConvention;
import com.execmetrics.exception.ConfigurationException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the batch run.
 *
 * <p>Binds to the {@code execmetrics.*} prefix in application.properties. Dataset paths default
 * to the {@code EXECUTIONS_FILE_PATH}, {@code REFDATA_FILE_PATH}, {@code MARKETDATA_FILE_PATH}
 * and {@code OUTPUT_FILE_PATH} environment variables, falling back to files under
 * {@code data/} and {@code output/}.
 */
@Configuration
@ConfigurationProperties(prefix = "execmetrics")
@Getter
@Setter
public class ExecMetricsProperties {

    private DataPaths data = new DataPaths();

    private Engine engine = new Engine();

    private Runner runner = new Runner();

    /** Longest usable tolerance or quote offset; keeps every time span well inside nanosecond range. */
    static final Duration MAX_WINDOW = Duration.ofDays(30);

    /**
     * Converts the bound engine properties into the immutable structure the engine consumes.
     *
     * @throws ConfigurationException if the tolerance is not positive or either window exceeds
     *     {@link #MAX_WINDOW}
     */
    public EngineConfig toEngineConfig() {
        Duration tolerance = engine.getTolerance();
        if (tolerance == null || tolerance.isNegative() || tolerance.isZero()) {
            throw new ConfigurationException("execmetrics.engine.tolerance must be positive, got " + tolerance);
        }
        if (tolerance.compareTo(MAX_WINDOW) > 0) {
            throw new ConfigurationException(
                    "execmetrics.engine.tolerance must not exceed " + MAX_WINDOW + ", got " + tolerance);
        }
        Duration quoteOffset = engine.getQuoteOffset();
        if (quoteOffset == null || quoteOffset.isNegative() || quoteOffset.compareTo(MAX_WINDOW) > 0) {
            throw new ConfigurationException(
                    "execmetrics.engine.quote-offset must be between 0 and " + MAX_WINDOW + ", got " + quoteOffset);
        }
        return EngineConfig.builder()
                .tolerance(tolerance)
                .quoteOffset(quoteOffset)
                .signConvention(engine.getSignConvention())
                .includedPhases(Set.copyOf(engine.getIncludedPhases()))
                .includedMarketStates(Set.copyOf(engine.getIncludedMarketStates()))
                .parallel(engine.isParallel())
                .build();
    }

    @Getter
    @Setter
    public static class DataPaths {

        private String executionsPath = "data/executions.csv";

        private String refdataPath = "data/refdata.csv";

        private String marketdataPath = "data/marketdata.csv";

        /** Aggregate table path. Detail and skipped tables are written next to it. */
        private String outputPath = "output/trading_metrics.csv";
    }

    @Getter
    @Setter
    public static class Engine {

        private Duration tolerance = Duration.ofSeconds(5);

        private Duration quoteOffset = Duration.ofSeconds(1);

        private SlippageSignConvention signConvention = SlippageSignConvention.FAVORABLE_POSITIVE;

        private Set<String> includedPhases = new LinkedHashSet<>();

        private Set<String> includedMarketStates = new LinkedHashSet<>();

        private boolean parallel = false;
    }

    @Getter
    @Setter
    public static class Runner {

        /** When false the application context starts without running the batch (used by tests). */
        private boolean enabled = true;
    }
}
