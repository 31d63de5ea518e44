package com.execmetrics.domain.model;

import com.execmetrics.domain.enums.SkipReason;
import lombok.Builder;
import lombok.Value;

/** An execution that produced no metric record, with the reason it was skipped. */
@Value
@Builder
public class SkippedExecution {

    String executionId;
    String instrumentId;
    SkipReason reason;
    String detail;
}
