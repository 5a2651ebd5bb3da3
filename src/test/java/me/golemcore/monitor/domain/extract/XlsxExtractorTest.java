package me.golemcore.monitor.domain.extract;

import me.golemcore.monitor.domain.model.Attachment;
import me.golemcore.monitor.domain.model.ExtractionResult;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class XlsxExtractorTest {

    private final XlsxExtractor extractor = new XlsxExtractor();

    @Test
    void shouldReadSheetsInWorkbookOrderWithDisplayedValues() throws IOException {
        byte[] xlsx;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            XSSFSheet candidates = workbook.createSheet("Candidates");
            Row header = candidates.createRow(0);
            header.createCell(0).setCellValue("Name");
            header.createCell(1).setCellValue("Score");
            header.createCell(2).setCellValue("Joined");
            Row first = candidates.createRow(1);
            first.createCell(0).setCellValue("Varun");
            first.createCell(1).setCellValue(42);
            first.createCell(2).setCellValue(LocalDate.of(2026, 3, 1));
            first.getCell(2).setCellStyle(dateStyle);

            XSSFSheet totals = workbook.createSheet("Totals");
            Row total = totals.createRow(0);
            total.createCell(0).setCellValue("Double score");
            total.createCell(1).setCellFormula("Candidates!B2*2");
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();

            workbook.write(out);
            xlsx = out.toByteArray();
        }

        ExtractionResult result = extractor.extract(attachment(xlsx));

        assertTrue(result.isText());
        String text = result.text();
        assertTrue(text.contains("Name Score Joined"));
        assertTrue(text.contains("Varun 42 2026-03-01"));
        assertTrue(text.contains("Double score 84"));
        assertTrue(text.indexOf("Varun") < text.indexOf("Double score"));
        assertFalse(text.contains("Candidates!B2"));
    }

    @Test
    void shouldReportBrokenWorkbookAsDecodeError() {
        ExtractionResult result = extractor.extract(attachment("not a workbook".getBytes(StandardCharsets.UTF_8)));

        assertTrue(result.isDecodeError());
        assertTrue(result.reason().startsWith("unreadable XLSX"));
    }

    private static Attachment attachment(byte[] bytes) {
        return Attachment.builder().filename("scores.xlsx").rawBytes(bytes).build();
    }
}
