package com.execmetrics.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * A timestamped quote/trade snapshot for one instrument.
 *
 * <p>Any of bid, ask and last may be null. When both sides are present bid must not exceed ask;
 * the series index enforces this at build time.
 */
@Value
@Builder
public class MarketObservation {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    String instrumentId;
    LocalDateTime timestamp;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal last;
    BigDecimal volume;

    /** Trading phase of the market at this instant, e.g. "CONTINUOUS_TRADING". Null if unknown. */
    String marketState;

    /**
     * Price used as a benchmark candidate: last trade if present, else the bid/ask midpoint,
     * else whichever side is present. Null when the observation carries no price at all.
     */
    public BigDecimal usablePrice() {
        if (last != null) {
            return last;
        }
        if (bid != null && ask != null) {
            return bid.add(ask).divide(TWO, Math.max(bid.scale(), ask.scale()) + 1, RoundingMode.HALF_EVEN);
        }
        return bid != null ? bid : ask;
    }

    public boolean hasUsablePrice() {
        return last != null || bid != null || ask != null;
    }

    /** True when both sides of the quote are present. */
    public boolean hasQuote() {
        return bid != null && ask != null;
    }

    /** Compares bid, ask and last numerically, so 10.5 and 10.50 are the same price. */
    public boolean hasSamePricesAs(MarketObservation other) {
        return sameNumber(bid, other.bid) && sameNumber(ask, other.ask) && sameNumber(last, other.last);
    }

    private static boolean sameNumber(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return Objects.equals(a, b);
        }
        return a.compareTo(b) == 0;
    }
}
