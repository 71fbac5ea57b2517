package com.eyelevel.paperprocessor.service.rendering;

import com.eyelevel.paperprocessor.model.RenderedArtifact;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Used when no PDF library is configured or present. Returns a fixed notice instead of text.
 */
@Service("unavailableArtifactReader")
public class UnavailableArtifactReader implements RenderedArtifactReader {

    public static final String UNAVAILABLE_TEXT =
            "[Rendered text extraction unavailable: PDF reader library not present]";

    @Override
    public RenderedArtifact read(byte[] pdf) {
        return new RenderedArtifact(UNAVAILABLE_TEXT, Map.of());
    }

    @Override
    public String name() {
        return "none";
    }
}
