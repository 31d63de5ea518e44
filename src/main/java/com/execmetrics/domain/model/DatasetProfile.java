package com.execmetrics.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Descriptive statistics of the loaded datasets, logged before metrics are computed. */
@Value
@Builder
public class DatasetProfile {

    int executionCount;
    int uniqueVenues;
    int uniqueTradeDates;
    LocalDateTime firstExecutionTime;
    LocalDateTime lastExecutionTime;
    int observationCount;
    int instrumentsWithMarketData;
    LocalDateTime firstObservationTime;
    LocalDateTime lastObservationTime;
}
