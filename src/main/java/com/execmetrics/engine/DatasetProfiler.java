package com.execmetrics.engine;

import com.execmetrics.domain.model.DatasetProfile;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.domain.model.MarketObservation;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Summarizes the loaded datasets so the log shows what a run was computed over. */
@Component
public class DatasetProfiler {

    private static final Logger log = LoggerFactory.getLogger(DatasetProfiler.class);

    public DatasetProfile profile(List<Execution> executions, List<MarketObservation> observations) {
        DatasetProfile profile = DatasetProfile.builder()
                .executionCount(executions.size())
                .uniqueVenues((int) executions.stream()
                        .map(Execution::getVenue)
                        .filter(Objects::nonNull)
                        .distinct()
                        .count())
                .uniqueTradeDates((int) executions.stream()
                        .map(Execution::getTimestamp)
                        .filter(Objects::nonNull)
                        .map(LocalDateTime::toLocalDate)
                        .distinct()
                        .count())
                .firstExecutionTime(min(executions.stream().map(Execution::getTimestamp).toList()))
                .lastExecutionTime(max(executions.stream().map(Execution::getTimestamp).toList()))
                .observationCount(observations.size())
                .instrumentsWithMarketData((int) observations.stream()
                        .map(MarketObservation::getInstrumentId)
                        .distinct()
                        .count())
                .firstObservationTime(min(observations.stream().map(MarketObservation::getTimestamp).toList()))
                .lastObservationTime(max(observations.stream().map(MarketObservation::getTimestamp).toList()))
                .build();

        log.info(
                "Executions: {} across {} venues and {} dates, trade time {} to {}",
                profile.getExecutionCount(),
                profile.getUniqueVenues(),
                profile.getUniqueTradeDates(),
                profile.getFirstExecutionTime(),
                profile.getLastExecutionTime());
        log.info(
                "Market data: {} observations for {} instruments, event time {} to {}",
                profile.getObservationCount(),
                profile.getInstrumentsWithMarketData(),
                profile.getFirstObservationTime(),
                profile.getLastObservationTime());
        return profile;
    }

    private static LocalDateTime min(List<LocalDateTime> times) {
        return times.stream().filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null);
    }

    private static LocalDateTime max(List<LocalDateTime> times) {
        return times.stream().filter(Objects::nonNull).max(Comparator.naturalOrder()).orElse(null);
    }
}
