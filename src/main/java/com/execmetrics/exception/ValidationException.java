package com.execmetrics.exception;

import com.execmetrics.domain.enums.SkipReason;
import lombok.Getter;

/**
 * A single execution that cannot be measured. Never fatal: the execution is recorded as
 * skipped with {@link #getReason()} and the run continues.
 */
@Getter
public class ValidationException extends BaseException {

    private final SkipReason reason;

    public ValidationException(SkipReason reason, String message) {
        super(ErrorCode.VALIDATION, message);
        this.reason = reason;
    }
}
