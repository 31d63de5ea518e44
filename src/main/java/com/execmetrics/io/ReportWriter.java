package com.execmetrics.io;

import com.execmetrics.domain.model.AggregateRow;
import com.execmetrics.domain.model.MetricRecord;
import com.execmetrics.domain.model.QuoteSnapshot;
import com.execmetrics.domain.model.SkippedExecution;
import com.execmetrics.engine.ExecutionMetricsReport;
import com.execmetrics.exception.DatasetIoException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a report as three CSV tables.
 *
 * <p>Given {@code output/trading_metrics.csv} it writes the aggregate table there, the
 * per-execution detail to {@code output/trading_metrics-details.csv} and the skipped executions
 * to {@code output/trading_metrics-skipped.csv}. Missing parent directories are created.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final CsvMapper csvMapper;

    public ReportWriter() {
        this.csvMapper = new CsvMapper();
    }

    public void write(ExecutionMetricsReport report, Path outputPath) {
        Path parent = outputPath.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new DatasetIoException("Failed to create output directory " + parent, e);
        }

        writeTable(outputPath, AggregateCsvRow.class, report.getAggregates().stream()
                .map(AggregateCsvRow::of)
                .toList());
        writeTable(siblingPath(outputPath, "details"), DetailCsvRow.class, report.getDetails().stream()
                .map(DetailCsvRow::of)
                .toList());
        writeTable(siblingPath(outputPath, "skipped"), SkippedCsvRow.class, report.getSkipped().stream()
                .map(SkippedCsvRow::of)
                .toList());

        log.info(
                "Output saved to '{}' ({} aggregate rows, {} details, {} skipped)",
                outputPath,
                report.getAggregates().size(),
                report.getDetails().size(),
                report.getSkipped().size());
    }

    /** {@code dir/name.csv} + "details" -> {@code dir/name-details.csv}. */
    static Path siblingPath(Path outputPath, String suffix) {
        String fileName = outputPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : ".csv";
        return outputPath.resolveSibling(stem + "-" + suffix + extension);
    }

    private <T> void writeTable(Path path, Class<T> rowType, List<T> rows) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        try {
            csvMapper.writer(schema).writeValue(path.toFile(), rows);
        } catch (IOException e) {
            throw new DatasetIoException("Failed to write " + path, e);
        }
    }

    /** Plain notation without trailing zeros: 105.0 and 105 both print as "105". */
    private static String plain(BigDecimal value) {
        return value != null ? value.stripTrailingZeros().toPlainString() : null;
    }

    private static String bid(QuoteSnapshot quote) {
        return quote != null ? plain(quote.getBid()) : null;
    }

    private static String ask(QuoteSnapshot quote) {
        return quote != null ? plain(quote.getAsk()) : null;
    }

    private static String mid(QuoteSnapshot quote) {
        return quote != null ? plain(quote.getMid()) : null;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    @JsonPropertyOrder({
        "group_dimension",
        "group_key",
        "currency",
        "execution_count",
        "total_quantity",
        "total_notional",
        "weighted_slippage",
        "weighted_slippage_bps"
    })
    record AggregateCsvRow(
            @JsonProperty("group_dimension") String groupDimension,
            @JsonProperty("group_key") String groupKey,
            @JsonProperty("currency") String currency,
            @JsonProperty("execution_count") long executionCount,
            @JsonProperty("total_quantity") String totalQuantity,
            @JsonProperty("total_notional") String totalNotional,
            @JsonProperty("weighted_slippage") String weightedSlippage,
            @JsonProperty("weighted_slippage_bps") String weightedSlippageBps) {

        static AggregateCsvRow of(AggregateRow row) {
            return new AggregateCsvRow(
                    row.getKey().getDimension().name(),
                    row.getKey().label(),
                    row.getCurrency(),
                    row.getExecutionCount(),
                    plain(row.getTotalQuantity()),
                    plain(row.getTotalNotional()),
                    plain(row.getWeightedSlippage()),
                    plain(row.getWeightedSlippageBps()));
        }
    }

    @JsonPropertyOrder({
        "execution_id",
        "instrument_id",
        "isin",
        "ticker",
        "primary_mic",
        "currency",
        "side",
        "venue",
        "execution_time",
        "quantity",
        "execution_price",
        "benchmark_price",
        "benchmark_method",
        "slippage",
        "slippage_bps",
        "notional",
        "best_bid",
        "best_ask",
        "mid_price",
        "best_bid_before",
        "best_ask_before",
        "mid_price_before",
        "best_bid_after",
        "best_ask_after",
        "mid_price_after",
        "spread_capture"
    })
    record DetailCsvRow(
            @JsonProperty("execution_id") String executionId,
            @JsonProperty("instrument_id") String instrumentId,
            @JsonProperty("isin") String isin,
            @JsonProperty("ticker") String ticker,
            @JsonProperty("primary_mic") String primaryMic,
            @JsonProperty("currency") String currency,
            @JsonProperty("side") String side,
            @JsonProperty("venue") String venue,
            @JsonProperty("execution_time") String executionTime,
            @JsonProperty("quantity") String quantity,
            @JsonProperty("execution_price") String executionPrice,
            @JsonProperty("benchmark_price") String benchmarkPrice,
            @JsonProperty("benchmark_method") String benchmarkMethod,
            @JsonProperty("slippage") String slippage,
            @JsonProperty("slippage_bps") String slippageBps,
            @JsonProperty("notional") String notional,
            @JsonProperty("best_bid") String bestBid,
            @JsonProperty("best_ask") String bestAsk,
            @JsonProperty("mid_price") String midPrice,
            @JsonProperty("best_bid_before") String bestBidBefore,
            @JsonProperty("best_ask_before") String bestAskBefore,
            @JsonProperty("mid_price_before") String midPriceBefore,
            @JsonProperty("best_bid_after") String bestBidAfter,
            @JsonProperty("best_ask_after") String bestAskAfter,
            @JsonProperty("mid_price_after") String midPriceAfter,
            @JsonProperty("spread_capture") String spreadCapture) {

        static DetailCsvRow of(MetricRecord record) {
            return new DetailCsvRow(
                    record.getExecutionId(),
                    record.getInstrumentId(),
                    record.getIsin(),
                    record.getTicker(),
                    record.getPrimaryMic(),
                    record.getCurrency(),
                    text(record.getSide()),
                    record.getVenue(),
                    text(record.getExecutionTime()),
                    plain(record.getQuantity()),
                    plain(record.getExecutionPrice()),
                    plain(record.getBenchmarkPrice()),
                    text(record.getBenchmarkMethod()),
                    plain(record.getSlippage()),
                    plain(record.getSlippageBps()),
                    plain(record.getNotional()),
                    bid(record.getQuote()),
                    ask(record.getQuote()),
                    mid(record.getQuote()),
                    bid(record.getQuoteBefore()),
                    ask(record.getQuoteBefore()),
                    mid(record.getQuoteBefore()),
                    bid(record.getQuoteAfter()),
                    ask(record.getQuoteAfter()),
                    mid(record.getQuoteAfter()),
                    plain(record.getSpreadCapture()));
        }
    }

    @JsonPropertyOrder({"execution_id", "instrument_id", "reason", "detail"})
    record SkippedCsvRow(
            @JsonProperty("execution_id") String executionId,
            @JsonProperty("instrument_id") String instrumentId,
            @JsonProperty("reason") String reason,
            @JsonProperty("detail") String detail) {

        static SkippedCsvRow of(SkippedExecution skipped) {
            return new SkippedCsvRow(
                    skipped.getExecutionId(),
                    skipped.getInstrumentId(),
                    skipped.getReason().getDescription(),
                    skipped.getDetail());
        }
    }
}
