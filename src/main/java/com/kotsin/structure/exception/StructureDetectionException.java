package com.kotsin.structure.exception;

/**
 * Base exception for the structure detector.
 * Carries a structured error code so adapters can tell input problems
 * apart from defects.
 */
public class StructureDetectionException extends RuntimeException {

    public enum ErrorCode {
        BAR_OUT_OF_ORDER,
        INVALID_BAR,
        INVARIANT_VIOLATION,
        INVALID_CONFIGURATION,
        INVALID_SNAPSHOT
    }

    private final ErrorCode errorCode;

    public StructureDetectionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StructureDetectionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Input problems are rejected at ingestion; everything else is a defect
     * or a setup error.
     */
    public boolean isInputError() {
        return errorCode == ErrorCode.BAR_OUT_OF_ORDER || errorCode == ErrorCode.INVALID_BAR;
    }
}
