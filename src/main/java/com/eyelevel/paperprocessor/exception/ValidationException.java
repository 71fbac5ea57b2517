package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;

import java.io.Serial;

/**
 * Thrown when a paper identifier is malformed. Raised before any resource is acquired.
 */
public class ValidationException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = -3320175403921785411L;

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.VALIDATION;
    }
}
