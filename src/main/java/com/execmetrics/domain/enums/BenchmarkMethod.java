package com.execmetrics.domain.enums;

/** How a benchmark price was derived from the market series. */
public enum BenchmarkMethod {
    /** An observation exists at exactly the execution timestamp. */
    EXACT,
    /** Linear interpolation between the observations bracketing the timestamp. */
    INTERPOLATED,
    /** Only an earlier observation was within tolerance. */
    NEAREST_BEFORE,
    /** Only a later observation was within tolerance. */
    NEAREST_AFTER
}
