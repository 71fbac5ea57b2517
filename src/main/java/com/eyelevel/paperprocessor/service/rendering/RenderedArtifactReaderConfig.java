package com.eyelevel.paperprocessor.service.rendering;

import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Provides the active {@link RenderedArtifactReader} as a bean named {@code renderedArtifactReader}.
 *
 * <pre>
 * app:
 *   processing:
 *     rendering:
 *       reader: pdfbox        # or none
 * </pre>
 * <p>
 * {@code pdfbox} only takes effect when PDFBox is on the classpath; otherwise the unavailable reader is used
 * and every run that asks for a rendered artifact gets its fixed notice text.
 */
@Configuration
@Slf4j
public class RenderedArtifactReaderConfig {

    @Bean(name = "renderedArtifactReader")
    public RenderedArtifactReader renderedArtifactReader(
            @Qualifier("pdfBoxArtifactReader") ObjectProvider<RenderedArtifactReader> pdfBox,
            @Qualifier("unavailableArtifactReader") RenderedArtifactReader unavailable,
            PaperProcessingConfig config) {

        String reader = config.getRendering().getReader();

        if (reader == null || reader.isBlank()) {
            log.warn("No rendered-artifact reader configured. Defaulting to 'none'.");
            return unavailable;
        }

        log.info("Initializing rendered-artifact reader. Selected reader: '{}'", reader);

        return switch (reader.trim().toLowerCase(Locale.ROOT)) {
            case "pdfbox" -> {
                RenderedArtifactReader available = pdfBox.getIfAvailable();
                if (available == null) {
                    log.warn("PDFBox is not on the classpath. Rendered text extraction is unavailable.");
                    yield unavailable;
                }
                log.info("Rendered artifacts will be read with Apache PDFBox.");
                yield available;
            }
            case "none" -> {
                log.info("Rendered-artifact reading disabled.");
                yield unavailable;
            }
            default -> {
                log.error("Unknown rendered-artifact reader '{}'. Falling back to 'none'.", reader);
                yield unavailable;
            }
        };
    }
}
