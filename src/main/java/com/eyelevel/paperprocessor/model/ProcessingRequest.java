package com.eyelevel.paperprocessor.model;

import java.util.Objects;

/**
 * A single caller request to run a paper through the pipeline.
 *
 * @param id                      The paper identifier, e.g. {@code 2404.04895v2} or {@code hep-th/9901001}.
 * @param includeRenderedArtifact Whether to compile the sources and read the rendered PDF.
 */
public record ProcessingRequest(String id, boolean includeRenderedArtifact) {

    public ProcessingRequest {
        Objects.requireNonNull(id, "id must not be null");
    }
}
