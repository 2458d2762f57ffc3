package com.kotsin.structure.exception;

/**
 * A structural invariant was broken. Always a programming defect, never bad input.
 */
public class InvariantViolationException extends StructureDetectionException {

    public InvariantViolationException(String message) {
        super(ErrorCode.INVARIANT_VIOLATION, message);
    }
}
