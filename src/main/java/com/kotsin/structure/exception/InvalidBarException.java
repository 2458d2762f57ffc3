package com.kotsin.structure.exception;

/**
 * Malformed bar (non-finite price, high below low, open/close outside the range).
 */
public class InvalidBarException extends StructureDetectionException {

    public InvalidBarException(String message) {
        super(ErrorCode.INVALID_BAR, message);
    }
}
