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
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads every sheet of a workbook in workbook order, cells in row-major order.
 * Numeric and date cells are rendered the way the spreadsheet displays them;
 * formula cells use their cached result.
 */
@Component
public class XlsxExtractor implements AttachmentExtractor {

    @Override
    public AttachmentFormat format() {
        return AttachmentFormat.XLSX;
    }

    @Override
    public ExtractionResult extract(Attachment attachment) {
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(attachment.rawBytes()))) {
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            StringBuilder sb = new StringBuilder();
            for (Sheet sheet : workbook) {
                appendSheet(sheet, formatter, sb);
                sb.append('\n');
            }
            return ExtractionResult.text(sb.toString());
        } catch (Exception e) { // NOSONAR - POI signals broken containers with unchecked exceptions too
            return ExtractionResult.decodeError("unreadable XLSX: " + e.getMessage());
        }
    }

    private static void appendSheet(Sheet sheet, DataFormatter formatter, StringBuilder sb) {
        for (Row row : sheet) {
            List<String> values = new ArrayList<>();
            for (Cell cell : row) {
                String value = cellText(cell, formatter);
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            if (!values.isEmpty()) {
                sb.append(String.join(" ", values)).append('\n');
            }
        }
    }

    static String cellText(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }
        CellStyle style = cell.getCellStyle();
        return switch (cell.getCachedFormulaResultType()) {
        case NUMERIC -> formatter.formatRawCellContents(cell.getNumericCellValue(),
                style.getDataFormat(), style.getDataFormatString());
        case STRING -> cell.getRichStringCellValue().getString();
        case BOOLEAN -> cell.getBooleanCellValue() ? "TRUE" : "FALSE";
        default -> "";
        };
    }
}
