package com.eainde.comps.sheet;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoiSpreadsheetDecoderTest {

    private final PoiSpreadsheetDecoder decoder = new PoiSpreadsheetDecoder();

    @Test
    void decode_shouldReturnSheetsInWorkbookOrderWithFormattedCells() throws IOException {
        // Arrange
        byte[] xlsx;
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet cover = wb.createSheet("Cover");
            cover.createRow(0).createCell(0).setCellValue("Project Fizz");

            Sheet comps = wb.createSheet("Trading Comps");
            Row header = comps.createRow(0);
            header.createCell(0).setCellValue("Company");
            header.createCell(1).setCellValue("EV/EBITDA");
            Row pepsi = comps.createRow(2);             // row 1 left empty
            pepsi.createCell(0).setCellValue("  PepsiCo ");
            pepsi.createCell(1).setCellValue(14);
            pepsi.createCell(3).setCellValue("");        // trailing blank
            Row total = comps.createRow(3);
            total.createCell(0).setCellValue("Total");
            total.createCell(1).setCellFormula("B3*2");
            xlsx = toBytes(wb);
        }

        // Act
        Map<String, List<List<String>>> sheets = decoder.decode("deal.xlsx", xlsx);

        // Assert
        assertThat(sheets.keySet()).containsExactly("Cover", "Trading Comps");
        assertThat(sheets.get("Trading Comps")).containsExactly(
                List.of("Company", "EV/EBITDA"),
                List.of("PepsiCo", "14"),
                List.of("Total", "28"));
    }

    @Test
    void decode_shouldReadLegacyXls() throws IOException {
        byte[] xls;
        try (Workbook wb = new HSSFWorkbook()) {
            wb.createSheet("Peers").createRow(0).createCell(0).setCellValue("Nestlé");
            xls = toBytes(wb);
        }

        assertThat(decoder.decode("old.xls", xls).get("Peers")).containsExactly(List.of("Nestlé"));
    }

    @Test
    void decode_shouldRejectCsv() {
        byte[] csv = "Company\nPepsiCo\n".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode("comps.csv", csv))
                .isInstanceOf(SpreadsheetDecodingException.class)
                .hasMessageContaining("CSV");
    }

    @Test
    void decode_shouldWrapUnreadableContent() {
        byte[] garbage = "definitely not a workbook".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode("broken.xlsx", garbage))
                .isInstanceOf(SpreadsheetDecodingException.class)
                .hasMessageContaining("broken.xlsx");
    }

    @Test
    void decode_shouldRejectEmptyContent() {
        assertThatThrownBy(() -> decoder.decode("empty.xlsx", new byte[0]))
                .isInstanceOf(SpreadsheetDecodingException.class);
    }

    private static byte[] toBytes(Workbook wb) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        wb.write(out);
        return out.toByteArray();
    }
}
