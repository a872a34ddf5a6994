package com.eainde.comps.model;

import java.util.List;

/**
 * The one sheet chosen from a workbook, with its rows in file order.
 *
 * @param fileId    id of the {@link FileReference} the sheet came from
 * @param fileName  display name of that file
 * @param sheetName tab name as it appears in the workbook
 * @param rows      ordered rows, each an ordered list of cell strings
 */
public record SelectedSheet(
        String fileId,
        String fileName,
        String sheetName,
        List<List<String>> rows
) {

    public SelectedSheet {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return String.format("Sheet[%s / %s, %d rows]", fileName, sheetName, rows.size());
    }
}
