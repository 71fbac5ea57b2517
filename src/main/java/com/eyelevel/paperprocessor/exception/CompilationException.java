package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.CompilationFailureKind;
import com.eyelevel.paperprocessor.model.ErrorType;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown inside the compiler when a pdflatex run fails. The compiler converts it into a
 * {@link com.eyelevel.paperprocessor.model.CompilationOutcome.Failure} before returning.
 */
@Getter
public class CompilationException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = 7731964021337456719L;

    private final CompilationFailureKind kind;

    public CompilationException(CompilationFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CompilationException(CompilationFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.COMPILATION;
    }
}
