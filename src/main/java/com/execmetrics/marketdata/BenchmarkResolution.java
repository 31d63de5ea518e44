package com.execmetrics.marketdata;

import com.execmetrics.domain.enums.BenchmarkMethod;
import com.execmetrics.domain.enums.SkipReason;
import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Outcome of a benchmark lookup: either a price with the method that produced it, or the reason none exists. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BenchmarkResolution {

    BigDecimal price;
    BenchmarkMethod method;
    SkipReason unresolvedReason;

    public static BenchmarkResolution resolved(BigDecimal price, BenchmarkMethod method) {
        return new BenchmarkResolution(price, method, null);
    }

    public static BenchmarkResolution unresolved(SkipReason reason) {
        return new BenchmarkResolution(null, null, reason);
    }

    public boolean isResolved() {
        return price != null;
    }
}
