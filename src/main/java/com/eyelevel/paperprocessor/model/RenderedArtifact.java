package com.eyelevel.paperprocessor.model;

import java.util.Map;

/**
 * Text and metadata read from a rendered document.
 *
 * @param text     The extracted text, or an explicit unavailability notice. Never null.
 * @param metadata Document metadata such as title, author and page count. Empty when no reader is available.
 */
public record RenderedArtifact(String text, Map<String, Object> metadata) {

    public RenderedArtifact {
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
