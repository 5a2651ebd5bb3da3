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
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the body of a word-processing document in document order: paragraphs
 * and table cells. Headers, footers and images are ignored.
 */
@Component
public class DocxExtractor implements AttachmentExtractor {

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.DOCX;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(attachment.rawBytes()))) {
            StringBuilder sb = new StringBuilder();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    sb.append(paragraph.getText()).append('\n');
                } else if (element instanceof XWPFTable table) {
                    appendTable(table, sb);
                }
            }
            return ExtractionResult.text(sb.toString());
        } catch (Exception e) { // NOSONAR - POI signals broken containers with unchecked exceptions too
            return ExtractionResult.decodeError("unreadable DOCX: " + e.getMessage());
        }
    }

    private static void appendTable(XWPFTable table, StringBuilder sb) {
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                cells.add(cell.getText());
            }
            sb.append(String.join("\t", cells)).append('\n');
        }
    }
}
