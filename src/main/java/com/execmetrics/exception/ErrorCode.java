package com.execmetrics.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Failure categories of a batch run. The exit code is what the process returns when the run aborts. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION("VALIDATION", 1),
    DATA_INTEGRITY("DATA_INTEGRITY", 2),
    IO_ERROR("IO_ERROR", 3),
    CONFIGURATION("CONFIGURATION", 4);

    private final String code;
    private final int exitCode;
}
