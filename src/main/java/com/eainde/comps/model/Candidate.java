package com.eainde.comps.model;

/**
 * A raw company name as returned by one extraction call.
 *
 * @param rawName          the name exactly as the model returned it
 * @param sourceFileId     file the chunk belonged to
 * @param sourceChunkIndex index of the chunk within that file's sheet
 */
public record Candidate(
        String rawName,
        String sourceFileId,
        int sourceChunkIndex
) {}
