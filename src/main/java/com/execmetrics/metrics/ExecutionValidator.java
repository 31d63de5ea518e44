package com.execmetrics.metrics;

import com.execmetrics.domain.enums.SkipReason;
import com.execmetrics.domain.model.Execution;
import com.execmetrics.exception.ValidationException;

/** Structural checks on a single execution. Failures are per-execution and never fatal. */
final class ExecutionValidator {

    private ExecutionValidator() {}

    static void validate(Execution execution) {
        if (execution.getExecutionId() == null || execution.getExecutionId().isBlank()) {
            throw new ValidationException(SkipReason.INVALID_EXECUTION, "Execution without id");
        }
        if (execution.getInstrumentId() == null || execution.getInstrumentId().isBlank()) {
            throw new ValidationException(
                    SkipReason.INVALID_EXECUTION, "Execution " + execution.getExecutionId() + " has no instrument id");
        }
        if (execution.getSide() == null) {
            throw new ValidationException(
                    SkipReason.INVALID_EXECUTION, "Execution " + execution.getExecutionId() + " has no side");
        }
        if (execution.getTimestamp() == null) {
            throw new ValidationException(
                    SkipReason.INVALID_EXECUTION, "Execution " + execution.getExecutionId() + " has no timestamp");
        }
        requirePositiveQuantityAndPrice(execution);
    }

    static void requirePositiveQuantityAndPrice(Execution execution) {
        if (execution.getQuantity() == null || execution.getQuantity().signum() <= 0) {
            throw new ValidationException(
                    SkipReason.INVALID_EXECUTION,
                    String.format(
                            "Execution %s has non-positive quantity: %s",
                            execution.getExecutionId(), execution.getQuantity()));
        }
        if (execution.getPrice() == null || execution.getPrice().signum() <= 0) {
            throw new ValidationException(
                    SkipReason.INVALID_EXECUTION,
                    String.format(
                            "Execution %s has non-positive price: %s", execution.getExecutionId(), execution.getPrice()));
        }
    }
}
