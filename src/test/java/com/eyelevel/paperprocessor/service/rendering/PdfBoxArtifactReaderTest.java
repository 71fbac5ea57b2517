package com.eyelevel.paperprocessor.service.rendering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.paperprocessor.exception.RenderedArtifactException;
import com.eyelevel.paperprocessor.model.RenderedArtifact;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

/**
 * Verifies text and metadata extraction from generated PDFs.
 */
class PdfBoxArtifactReaderTest {

    private final PdfBoxArtifactReader reader = new PdfBoxArtifactReader();

    @Test
    void read_returnsPageTextAndMetadata() throws IOException {
        RenderedArtifact artifact = reader.read(pdf("Hello rendered world", "On Sliding Windows", "A. Author"));

        assertTrue(artifact.text().contains("Hello rendered world"), artifact.text());
        assertEquals("On Sliding Windows", artifact.metadata().get("title"));
        assertEquals("A. Author", artifact.metadata().get("author"));
        assertEquals(2, artifact.metadata().get("pages"));
    }

    @Test
    void read_omitsMissingMetadataFields() throws IOException {
        RenderedArtifact artifact = reader.read(pdf("Body", null, null));

        assertFalse(artifact.metadata().containsKey("title"));
        assertFalse(artifact.metadata().containsKey("author"));
        assertEquals(2, artifact.metadata().get("pages"));
    }

    @Test
    void read_rejectsMalformedPdf() {
        byte[] garbage = "this is not a pdf document".getBytes(StandardCharsets.US_ASCII);

        assertThrows(RenderedArtifactException.class, () -> reader.read(garbage));
    }

    private static byte[] pdf(String text, String title, String author) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            document.addPage(new PDPage());
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(text);
                content.endText();
            }
            PDDocumentInformation info = document.getDocumentInformation();
            info.setTitle(title);
            info.setAuthor(author);
            document.save(out);
            return out.toByteArray();
        }
    }
}
