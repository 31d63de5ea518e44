package com.execmetrics.io;

import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.Instrument;
import com.execmetrics.domain.model.MarketObservation;
import com.execmetrics.domain.model.SkippedExecution;
import com.execmetrics.engine.MetricsInput;
import com.execmetrics.exception.DataIntegrityException;
import com.execmetrics.exception.DatasetIoException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the executions, reference and market datasets from headered CSV files.
 *
 * <p>A malformed execution row is rejected on its own and reported as skipped. A malformed
 * reference or market data row is a data integrity failure that aborts the run.
 */
@Component
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    private final CsvMapper csvMapper;

    public DatasetLoader() {
        this.csvMapper = new CsvMapper();
    }

    public MetricsInput load(Path executionsPath, Path refdataPath, Path marketdataPath) {
        log.info("Loading data from {}, {}, {}", executionsPath, refdataPath, marketdataPath);
        MetricsInput.MetricsInputBuilder builder = MetricsInput.builder()
                .instruments(readStrict(refdataPath, DatasetLoader::toInstrument))
                .observations(readStrict(marketdataPath, DatasetLoader::toObservation));

        List<Execution> executions = new ArrayList<>();
        List<SkippedExecution> rejected = new ArrayList<>();
        for (CsvRow row : readRows(executionsPath)) {
            try {
                executions.add(toExecution(row));
            } catch (MalformedRowException e) {
                log.debug("Rejected execution row: {}", e.getMessage());
                rejected.add(SkippedExecution.builder()
                        .executionId(row.text(Columns.EXECUTION_ID))
                        .instrumentId(row.text(Columns.INSTRUMENT_ID))
                        .reason(SkipReason.MALFORMED_ROW)
                        .detail(e.getMessage())
                        .build());
            }
        }

        MetricsInput input = builder.executions(executions).rejectedExecutions(rejected).build();
        log.info(
                "Loaded {} executions ({} malformed), {} instruments, {} market observations",
                input.getExecutions().size(),
                rejected.size(),
                input.getInstruments().size(),
                input.getObservations().size());
        return input;
    }

    static Instrument toInstrument(CsvRow row) {
        row.requireCompleteRow();
        return Instrument.builder()
                .instrumentId(row.requiredText(Columns.INSTRUMENT_ID))
                .currency(row.requiredText(Columns.CURRENCY))
                .multiplier(row.requiredDecimal(Columns.MULTIPLIER))
                .tickSize(row.requiredDecimal(Columns.TICK_SIZE))
                .isin(row.text(Columns.ISIN))
                .ticker(row.text(Columns.TICKER))
                .primaryMic(row.text(Columns.PRIMARY_MIC))
                .build();
    }

    static MarketObservation toObservation(CsvRow row) {
        row.requireCompleteRow();
        BigDecimal volume = row.decimal(Columns.VOLUME);
        return MarketObservation.builder()
                .instrumentId(row.requiredText(Columns.INSTRUMENT_ID))
                .timestamp(row.requiredTimestamp(Columns.TIMESTAMP))
                .bid(row.decimal(Columns.BID))
                .ask(row.decimal(Columns.ASK))
                .last(row.decimal(Columns.LAST))
                .volume(volume != null ? volume : BigDecimal.ZERO)
                .marketState(row.text(Columns.MARKET_STATE))
                .build();
    }

    static Execution toExecution(CsvRow row) {
        row.requireCompleteRow();
        return Execution.builder()
                .executionId(row.requiredText(Columns.EXECUTION_ID))
                .instrumentId(row.requiredText(Columns.INSTRUMENT_ID))
                .side(row.requiredSide(Columns.SIDE))
                .quantity(row.requiredDecimal(Columns.QUANTITY))
                .price(row.requiredDecimal(Columns.PRICE))
                .timestamp(row.requiredTimestamp(Columns.TIMESTAMP))
                .venue(row.text(Columns.VENUE))
                .phase(row.text(Columns.PHASE))
                .build();
    }

    private <T> List<T> readStrict(Path path, Function<CsvRow, T> mapper) {
        List<T> result = new ArrayList<>();
        for (CsvRow row : readRows(path)) {
            try {
                result.add(mapper.apply(row));
            } catch (MalformedRowException e) {
                throw new DataIntegrityException("Malformed row in " + path + ": " + e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Reads every data row as raw cells keyed by the header. The cell count is checked per row
     * by {@link CsvRow}, so a short or over-long row fails on its own instead of aborting the read.
     * Blank lines are ignored.
     */
    List<CsvRow> readRows(Path path) {
        List<CsvRow> rows = new ArrayList<>();
        try (MappingIterator<String[]> iterator = csvMapper
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(path.toFile())) {
            if (!iterator.hasNextValue()) {
                return rows;
            }
            String[] header = iterator.nextValue();
            long lineNumber = 1;
            while (iterator.hasNextValue()) {
                lineNumber++;
                String[] cells = iterator.nextValue();
                if (isBlank(cells)) {
                    continue;
                }
                rows.add(CsvRow.of(lineNumber, header, cells));
            }
        } catch (IOException e) {
            throw new DatasetIoException("Failed to read " + path, e);
        }
        return rows;
    }

    private static boolean isBlank(String[] cells) {
        return cells.length == 0 || (cells.length == 1 && cells[0].isBlank());
    }
}
