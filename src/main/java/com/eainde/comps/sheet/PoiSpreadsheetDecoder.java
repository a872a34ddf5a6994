package com.eainde.comps.sheet;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Apache POI decoder for {@code .xlsx} and {@code .xls} workbooks.
 *
 * <p>Cells are rendered the way Excel displays them ({@link DataFormatter}). Formula cells
 * are evaluated; when evaluation is impossible (external links, unsupported functions)
 * the cached result stored in the file is used instead. Fully blank rows are dropped and
 * trailing blank cells trimmed, so every returned row carries at least one value.</p>
 */
@Component
public class PoiSpreadsheetDecoder implements SpreadsheetDecoder {

    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetDecoder.class);

    @Override
    public Map<String, List<List<String>>> decode(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new SpreadsheetDecodingException("Empty file: " + fileName);
        }
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new SpreadsheetDecodingException("CSV files are not supported: " + fileName);
        }

        try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            FormulaEvaluator evaluator = wb.getCreationHelper().createFormulaEvaluator();

            Map<String, List<List<String>>> sheets = new LinkedHashMap<>();
            for (int s = 0; s < wb.getNumberOfSheets(); s++) {
                Sheet sheet = wb.getSheetAt(s);
                sheets.put(sheet.getSheetName(), readRows(sheet, formatter, evaluator));
            }
            log.debug("Decoded {}: {} sheets: {}", fileName, sheets.size(), sheets.keySet());
            return sheets;
        } catch (IOException | RuntimeException e) {
            throw new SpreadsheetDecodingException(
                    "Could not read workbook " + fileName + ": " + e.getMessage(), e);
        }
    }

    private List<List<String>> readRows(Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator) {
        List<List<String>> rows = new ArrayList<>();
        for (Row row : sheet) {
            int lastCell = row.getLastCellNum();
            if (lastCell <= 0) continue;

            List<String> cells = new ArrayList<>(lastCell);
            for (int c = 0; c < lastCell; c++) {
                cells.add(cellText(row.getCell(c), formatter, evaluator));
            }
            while (!cells.isEmpty() && cells.get(cells.size() - 1).isEmpty()) {
                cells.remove(cells.size() - 1);
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }

    private String cellText(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
        if (cell == null) return "";
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell).strip();
        }
        try {
            return formatter.formatCellValue(cell, evaluator).strip();
        } catch (RuntimeException e) {
            log.debug("Formula evaluation failed at {}!{}: using cached value: {}",
                    cell.getSheet().getSheetName(), cell.getAddress(), e.getMessage());
            return cachedFormulaText(cell);
        }
    }

    private String cachedFormulaText(Cell cell) {
        return switch (cell.getCachedFormulaResultType()) {
            case NUMERIC -> stripTrailingZero(cell.getNumericCellValue());
            case STRING -> cell.getStringCellValue().strip();
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue()).toUpperCase(Locale.ROOT);
            default -> "";
        };
    }

    private String stripTrailingZero(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
