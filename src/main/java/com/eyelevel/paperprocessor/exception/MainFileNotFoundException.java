package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;

import java.io.Serial;

/**
 * Thrown when an extracted archive contains no LaTeX file that could serve as the main file.
 */
public class MainFileNotFoundException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = -144348853764116326L;

    public MainFileNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.PROCESSING;
    }
}
