package com.execmetrics.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Best bid, best ask and their midpoint taken from one two-sided market observation. */
@Value
@Builder
public class QuoteSnapshot {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /** Timestamp of the observation the quote was read from. */
    LocalDateTime observedAt;

    BigDecimal bid;
    BigDecimal ask;
    BigDecimal mid;

    /** Snapshot of a two-sided observation, or null when there is none. */
    public static QuoteSnapshot of(MarketObservation observation) {
        if (observation == null || !observation.hasQuote()) {
            return null;
        }
        return QuoteSnapshot.builder()
                .observedAt(observation.getTimestamp())
                .bid(observation.getBid())
                .ask(observation.getAsk())
                .mid(observation.getBid().add(observation.getAsk()).divide(TWO, MathContext.DECIMAL64))
                .build();
    }
}
