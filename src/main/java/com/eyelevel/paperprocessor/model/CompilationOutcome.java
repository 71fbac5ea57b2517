package com.eyelevel.paperprocessor.model;

import java.util.Objects;

/**
 * Result of a two-pass pdflatex compilation: either the rendered PDF or a classified failure.
 */
public sealed interface CompilationOutcome permits CompilationOutcome.Success, CompilationOutcome.Failure {

    static CompilationOutcome success(byte[] pdf) {
        return new Success(pdf);
    }

    static CompilationOutcome failure(CompilationFailureKind kind, String message) {
        return new Failure(kind, message);
    }

    /**
     * @param pdf The bytes of the rendered document.
     */
    record Success(byte[] pdf) implements CompilationOutcome {
        public Success {
            Objects.requireNonNull(pdf, "pdf must not be null");
        }
    }

    /**
     * @param kind    What went wrong.
     * @param message A human-readable description, including relevant pdflatex log lines where available.
     */
    record Failure(CompilationFailureKind kind, String message) implements CompilationOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind must not be null");
        }
    }
}
