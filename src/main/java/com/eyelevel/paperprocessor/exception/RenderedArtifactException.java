package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;

import java.io.Serial;

/**
 * Thrown when a rendered artifact cannot be parsed by an available reader.
 */
public class RenderedArtifactException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = 1866203710354862047L;

    public RenderedArtifactException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.RENDERED_ARTIFACT;
    }
}
