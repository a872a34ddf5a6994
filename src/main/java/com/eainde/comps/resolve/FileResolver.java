package com.eainde.comps.resolve;

import com.eainde.comps.model.FileReference;

/**
 * Turns a caller-supplied file reference into the file's bytes.
 */
public interface FileResolver {

    /**
     * @param reference opaque reference as it appeared in the request (path, item id, ...)
     * @return a resolved {@link FileReference}
     * @throws FileResolutionException when the file does not exist or cannot be read
     */
    FileReference resolve(String reference);
}
