package com.execmetrics.domain.model;

import com.execmetrics.domain.enums.Side;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** A single trade fill. Consumed exactly once by the resolver. */
@Value
@Builder
public class Execution {

    String executionId;
    String instrumentId;
    Side side;
    BigDecimal quantity;
    BigDecimal price;
    LocalDateTime timestamp;

    /** Venue the fill happened on. Optional. */
    String venue;

    /** Trading phase at fill time, e.g. "CONTINUOUS_TRADING" or "AUCTION". Optional. */
    String phase;
}
