package com.eainde.comps.resolve;

/**
 * A file reference could not be turned into content. Recorded per file; never fatal alone.
 */
public class FileResolutionException extends RuntimeException {

    public FileResolutionException(String message) {
        super(message);
    }

    public FileResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
