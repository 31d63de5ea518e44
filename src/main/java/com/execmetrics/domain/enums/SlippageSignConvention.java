package com.execmetrics.domain.enums;

/**
 * How the sign of slippage is oriented.
 *
 * <p>Under {@link #FAVORABLE_POSITIVE} a buy filled below the benchmark and a sell filled above
 * it both report positive slippage. {@link #ADVERSE_POSITIVE} flips both, so positive reads as cost.
 */
public enum SlippageSignConvention {
    FAVORABLE_POSITIVE,
    ADVERSE_POSITIVE;

    /** Multiplier applied to (execution price - benchmark) for the given side. */
    public int sideSign(Side side) {
        int favorable = side == Side.SELL ? 1 : -1;
        return this == FAVORABLE_POSITIVE ? favorable : -favorable;
    }
}
