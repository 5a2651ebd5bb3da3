package me.golemcore.monitor.domain.extract;

import me.golemcore.monitor.domain.model.Attachment;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttachmentFormatTest {

    @Test
    void shouldPreferExtensionOverMimeType() {
        assertEquals(AttachmentFormat.PDF, AttachmentFormat.detect(attachment("offer.pdf", "text/plain")));
    }

    @Test
    void shouldIgnoreExtensionCase() {
        assertEquals(AttachmentFormat.XLSX, AttachmentFormat.detect(attachment("SCORES.XLSX", "")));
    }

    @Test
    void shouldUseMimeTypeWhenFilenameHasNoExtension() {
        assertEquals(AttachmentFormat.PDF, AttachmentFormat.detect(attachment("offer", "application/pdf")));
        assertEquals(AttachmentFormat.PLAIN_TEXT,
                AttachmentFormat.detect(attachment("README", "text/plain; charset=UTF-8")));
    }

    @Test
    void shouldUseMimeTypeForGenericExtensions() {
        assertEquals(AttachmentFormat.CSV, AttachmentFormat.detect(attachment("export.bin", "text/csv")));
    }

    @Test
    void shouldNotLetMimeTypeRescueUnknownExtension() {
        assertEquals(AttachmentFormat.UNKNOWN, AttachmentFormat.detect(attachment("photo.png", "text/plain")));
    }

    @Test
    void shouldResolveUnknownWhenNothingIsKnown() {
        assertEquals(AttachmentFormat.UNKNOWN, AttachmentFormat.detect(attachment("", "")));
        assertEquals(AttachmentFormat.UNKNOWN,
                AttachmentFormat.detect(attachment("archive.tar.gz", "application/gzip")));
    }

    private static Attachment attachment(String filename, String mimeHint) {
        return Attachment.builder().filename(filename).mimeHint(mimeHint).build();
    }
}
