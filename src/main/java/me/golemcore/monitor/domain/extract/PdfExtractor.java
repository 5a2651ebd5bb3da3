package me.golemcore.monitor.domain.extract;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Extracts text page by page with PDFBox. A page that fails to parse is skipped
 * and the remaining pages are still read. Encrypted documents are not read.
 */
@Component
@Slf4j
public class PdfExtractor implements AttachmentExtractor {

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.PDF;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        try (PDDocument document = Loader.loadPDF(attachment.rawBytes())) {
            if (document.isEncrypted()) {
                return ExtractionResult.decodeError("encrypted PDF");
            }
            return ExtractionResult.text(extractPages(document, attachment.filename()));
        } catch (InvalidPasswordException e) {
            return ExtractionResult.decodeError("encrypted PDF");
        } catch (IOException | RuntimeException e) { // NOSONAR - PDFBox reports malformed input both ways
            return ExtractionResult.decodeError("unreadable PDF: " + e.getMessage());
        }
    }

    private String extractPages(PDDocument document, String filename) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        StringBuilder sb = new StringBuilder();
        int pageCount = document.getNumberOfPages();

        for (int page = 1; page <= pageCount; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            try {
                String pageText = stripper.getText(document);
                if (!pageText.isBlank()) {
                    sb.append(pageText.strip()).append('\n');
                }
            } catch (IOException | RuntimeException e) { // NOSONAR - skip the page, keep the document
                log.warn("[Extract] Skipping page {} of '{}': {}", page, filename, e.getMessage());
            }
        }

        if (sb.length() == 0 && pageCount > 0) {
            log.debug("[Extract] No text layer in '{}' (image-based PDF?)", filename);
        }
        return sb.toString();
    }
}
