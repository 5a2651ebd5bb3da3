package me.golemcore.monitor.domain.extract;

import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.ExtractionResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PdfExtractorTest {

    private final PdfExtractor extractor = new PdfExtractor();

    @Test
    void shouldExtractTextOfAllPagesInOrder() throws IOException {
        byte[] pdf = pdf(false, "Offer letter", "Candidate: Varun Kumar");

        ExtractionResult result = extractor.extract(attachment(pdf));

        assertTrue(result.isText());
        int first = result.text().indexOf("Offer letter");
        int second = result.text().indexOf("Candidate: Varun Kumar");
        assertTrue(first >= 0);
        assertTrue(second > first);
    }

    @Test
    void shouldReturnEmptyTextForPagesWithoutTextLayer() throws IOException {
        ExtractionResult result = extractor.extract(attachment(pdf(false, (String) null)));

        assertTrue(result.isText());
        assertEquals("", result.text());
    }

    @Test
    void shouldReportEncryptedPdfAsDecodeError() throws IOException {
        ExtractionResult result = extractor.extract(attachment(pdf(true, "Varun")));

        assertTrue(result.isDecodeError());
        assertEquals("encrypted PDF", result.reason());
    }

    @Test
    void shouldReportGarbageAsDecodeError() {
        byte[] bytes = "this is not a pdf at all".getBytes(StandardCharsets.US_ASCII);

        ExtractionResult result = extractor.extract(attachment(bytes));

        assertTrue(result.isDecodeError());
        assertTrue(result.reason().startsWith("unreadable PDF"));
    }

    private static Attachment attachment(byte[] bytes) {
        return Attachment.builder().filename("offer.pdf").mimeHint("application/pdf").rawBytes(bytes).build();
    }

    static byte[] pdf(boolean encrypted, String... pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (text == null) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            if (encrypted) {
                StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-secret", "user-secret",
                        new AccessPermission());
                policy.setEncryptionKeyLength(128);
                document.protect(policy);
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
