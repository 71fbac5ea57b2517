package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;

import java.io.Serial;

/**
 * A base exception for errors that occur during the paper processing pipeline.
 */
public class PaperProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public PaperProcessingException(String message) {
        super(message);
    }

    public PaperProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the classification reported to callers when this exception ends a pipeline run.
     */
    public ErrorType getErrorType() {
        return ErrorType.INTERNAL;
    }
}
