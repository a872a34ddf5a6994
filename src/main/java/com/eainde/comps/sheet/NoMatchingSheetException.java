package com.eainde.comps.sheet;

/**
 * No sheet of a workbook looked like a comps/competitor list, or the workbook could not
 * be decoded at all. Per-file and non-fatal: the file ends up in failed_files.
 */
public class NoMatchingSheetException extends RuntimeException {

    public NoMatchingSheetException(String message) {
        super(message);
    }

    public NoMatchingSheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
