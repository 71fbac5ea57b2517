package com.eyelevel.paperprocessor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * The outcome of running one paper through the pipeline.
 * <p>
 * Instances are only created through the factory methods, which keep two invariants:
 * a failed result never carries a main file or extracted text, and a result with a rendered
 * artifact always carries rendered text (possibly an unavailability notice).
 */
@Getter
@ToString(exclude = {"extractedText", "renderedText"})
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProcessingResult {

    private final String id;
    private final boolean success;
    private final String mainFile;
    private final String extractedText;
    private final int fileCount;
    private final boolean renderedArtifactProduced;
    private final String renderedText;
    private final Map<String, Object> renderedMetadata;
    private final Integer renderedArtifactSize;
    private final String compilationError;
    private final String error;
    private final ErrorType errorType;

    public static ProcessingResult success(String id, String mainFile, String extractedText, int fileCount) {
        return builder()
                .id(id)
                .success(true)
                .mainFile(mainFile)
                .extractedText(extractedText == null ? "" : extractedText)
                .fileCount(fileCount)
                .build();
    }

    public static ProcessingResult failure(String id, ErrorType errorType, String error) {
        return builder()
                .id(id)
                .success(false)
                .extractedText("")
                .error(error)
                .errorType(errorType)
                .build();
    }

    /**
     * Returns a copy of this successful result that carries the rendered document's text and metadata.
     */
    public ProcessingResult withRenderedArtifact(RenderedArtifact artifact, int artifactSize) {
        if (!success) {
            throw new IllegalStateException("A failed result cannot carry a rendered artifact");
        }
        return toBuilder()
                .renderedArtifactProduced(true)
                .renderedText(artifact.text())
                .renderedMetadata(artifact.metadata())
                .renderedArtifactSize(artifactSize)
                .compilationError(null)
                .build();
    }

    /**
     * Returns a copy of this result recording that the optional compilation step failed.
     * The run itself stays successful.
     */
    public ProcessingResult withCompilationError(String message) {
        return toBuilder()
                .renderedArtifactProduced(false)
                .renderedText(null)
                .renderedMetadata(null)
                .renderedArtifactSize(null)
                .compilationError(message)
                .build();
    }
}
