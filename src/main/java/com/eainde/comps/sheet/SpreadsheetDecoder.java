package com.eainde.comps.sheet;

import java.util.List;
import java.util.Map;

/**
 * Turns workbook bytes into sheets of string cells.
 */
public interface SpreadsheetDecoder {

    /**
     * @param fileName display name, used for format detection and messages
     * @param content  raw workbook bytes
     * @return sheet name to rows, in workbook order
     * @throws SpreadsheetDecodingException when the bytes are not a readable workbook
     */
    Map<String, List<List<String>>> decode(String fileName, byte[] content);
}
