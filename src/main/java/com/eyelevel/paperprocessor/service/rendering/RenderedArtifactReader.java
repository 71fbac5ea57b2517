package com.eyelevel.paperprocessor.service.rendering;

import com.eyelevel.paperprocessor.exception.RenderedArtifactException;
import com.eyelevel.paperprocessor.model.RenderedArtifact;

/**
 * Strategy interface for reading text and metadata out of a compiled PDF.
 */
public interface RenderedArtifactReader {

    /**
     * @param pdf The bytes of the compiled document.
     * @return The document's text and metadata.
     * @throws RenderedArtifactException if the bytes cannot be parsed.
     */
    RenderedArtifact read(byte[] pdf);

    String name();
}
