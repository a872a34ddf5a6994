package com.eainde.comps.sheet;

public class SpreadsheetDecodingException extends RuntimeException {

    public SpreadsheetDecodingException(String message) {
        super(message);
    }

    public SpreadsheetDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
