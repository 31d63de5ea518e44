package com.execmetrics.runner;

import com.execmetrics.config.EngineConfig;
import com.execmetrics.config.ExecMetricsProperties;
import com.execmetrics.engine.ExecutionMetricsEngine;
import com.execmetrics.engine.ExecutionMetricsReport;
import com.execmetrics.engine.MetricsInput;
import com.execmetrics.io.DatasetLoader;
import com.execmetrics.io.ReportWriter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one batch on application start: load the three datasets, compute metrics, write the report.
 *
 * <p>Exceptions propagate out of {@link #run(ApplicationArguments)}, which fails application
 * startup; the exception's error code becomes the process exit code.
 */
@Component
@ConditionalOnProperty(prefix = "execmetrics.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MetricsBatchRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MetricsBatchRunner.class);

    private final ExecMetricsProperties properties;
    private final DatasetLoader datasetLoader;
    private final ExecutionMetricsEngine engine;
    private final ReportWriter reportWriter;

    public MetricsBatchRunner(
            ExecMetricsProperties properties,
            DatasetLoader datasetLoader,
            ExecutionMetricsEngine engine,
            ReportWriter reportWriter) {
        this.properties = properties;
        this.datasetLoader = datasetLoader;
        this.engine = engine;
        this.reportWriter = reportWriter;
    }

    @Override
    public void run(ApplicationArguments args) {
        runBatch();
    }

    public ExecutionMetricsReport runBatch() {
        long start = System.nanoTime();
        ExecMetricsProperties.DataPaths paths = properties.getData();
        EngineConfig config = properties.toEngineConfig();

        MetricsInput input = datasetLoader.load(
                Path.of(paths.getExecutionsPath()), Path.of(paths.getRefdataPath()), Path.of(paths.getMarketdataPath()));

        log.info("Starting calculation of metrics...");
        ExecutionMetricsReport report = engine.run(input, config);

        reportWriter.write(report, Path.of(paths.getOutputPath()));

        log.info("Total execution time: {} ms", (System.nanoTime() - start) / 1_000_000);
        return report;
    }
}
