package com.execmetrics.exception;

import java.util.Map;
import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

@Getter
public abstract class BaseException extends RuntimeException implements ExitCodeGenerator {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    @Override
    public int getExitCode() {
        return errorCode.getExitCode();
    }
}
