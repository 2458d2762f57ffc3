package com.kotsin.structure.exception;

import java.util.List;

/**
 * Detection parameters that would produce pathological state.
 * Raised before any bar is processed.
 */
public class InvalidConfigurationException extends StructureDetectionException {

    private final List<String> errors;

    public InvalidConfigurationException(List<String> errors) {
        super(ErrorCode.INVALID_CONFIGURATION,
                "Detection configuration invalid: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
