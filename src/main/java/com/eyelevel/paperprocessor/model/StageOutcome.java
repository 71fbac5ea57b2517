package com.eyelevel.paperprocessor.model;

import com.eyelevel.paperprocessor.exception.PaperProcessingException;

import java.util.Objects;

/**
 * The explicit result of one pipeline stage: either its value or the typed error that ended it.
 *
 * @param <T> the value a successful stage produces.
 */
public sealed interface StageOutcome<T> permits StageOutcome.Success, StageOutcome.Failure {

    /**
     * Runs a stage and captures any {@link PaperProcessingException} it raises as a {@link Failure}.
     * Other runtime exceptions are not stage errors and propagate to the caller, as does interruption.
     */
    static <T> StageOutcome<T> attempt(PipelineStage stage, StageCall<T> work) throws InterruptedException {
        try {
            return new Success<>(work.call());
        } catch (PaperProcessingException e) {
            return new Failure<>(stage, e);
        }
    }

    @FunctionalInterface
    interface StageCall<T> {
        T call() throws InterruptedException;
    }

    record Success<T>(T value) implements StageOutcome<T> {
    }

    record Failure<T>(PipelineStage stage, PaperProcessingException error) implements StageOutcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
