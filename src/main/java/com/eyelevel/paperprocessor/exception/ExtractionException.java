package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;

import java.io.Serial;

/**
 * Thrown when an archive is oversized, corrupt, of an unknown format or contains an unsafe member path.
 */
public class ExtractionException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.EXTRACTION;
    }
}
