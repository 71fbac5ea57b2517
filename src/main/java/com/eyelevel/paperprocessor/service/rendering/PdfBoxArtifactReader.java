package com.eyelevel.paperprocessor.service.rendering;

import com.eyelevel.paperprocessor.exception.RenderedArtifactException;
import com.eyelevel.paperprocessor.model.RenderedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads compiled PDFs with Apache PDFBox: the text of every page plus the document information dictionary.
 */
@Slf4j
@Service("pdfBoxArtifactReader")
@ConditionalOnClass(name = "org.apache.pdfbox.Loader")
public class PdfBoxArtifactReader implements RenderedArtifactReader {

    @Override
    public RenderedArtifact read(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            final String text = new PDFTextStripper().getText(document);
            final Map<String, Object> metadata = new LinkedHashMap<>();
            final PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                putIfPresent(metadata, "title", info.getTitle());
                putIfPresent(metadata, "author", info.getAuthor());
                putIfPresent(metadata, "subject", info.getSubject());
                putIfPresent(metadata, "creator", info.getCreator());
            }
            metadata.put("pages", document.getNumberOfPages());
            log.debug("Read {} pages and {} characters from rendered PDF.", document.getNumberOfPages(), text.length());
            return new RenderedArtifact(text.trim(), metadata);
        } catch (IOException e) {
            throw new RenderedArtifactException("Failed to read rendered PDF: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "pdfbox";
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value);
        }
    }
}
